package org.biosignal.archiver.retrieval.conditioning;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * Approximate magnitude response of a device's bandpass filter over a geometric frequency grid.
 */
public class FrequencyResponse {
	private final double[] frequencies;
	private final double[] response;
	private final FilterBand band;
	private final double sampleRate;

	public FrequencyResponse(double[] frequencies, double[] response, FilterBand band, double sampleRate) {
		this.frequencies = frequencies;
		this.response = response;
		this.band = band;
		this.sampleRate = sampleRate;
	}

	public double[] getFrequencies() {
		return frequencies;
	}

	public double[] getResponse() {
		return response;
	}

	public FilterBand getBand() {
		return band;
	}

	public double getSampleRate() {
		return sampleRate;
	}

	@SuppressWarnings("unchecked")
	public JSONObject toJSON() {
		JSONObject ret = new JSONObject();
		JSONArray freqs = new JSONArray();
		JSONArray resp = new JSONArray();
		for(int i = 0; i < frequencies.length; i++) {
			freqs.add(frequencies[i]);
			resp.add(response[i]);
		}
		ret.put("frequencies", freqs);
		ret.put("response", resp);
		ret.put("lowCut", band.getLowCut());
		ret.put("highCut", band.getHighCut());
		ret.put("sampleRate", sampleRate);
		return ret;
	}
}
