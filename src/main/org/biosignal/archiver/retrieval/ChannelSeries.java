package org.biosignal.archiver.retrieval;

import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * The (timestamp, value) pairs for one channel in a query response, held as parallel arrays.
 */
public class ChannelSeries {
	private final long[] timestamps;
	private final double[] values;

	public ChannelSeries(long[] timestamps, double[] values) {
		if(timestamps.length != values.length) {
			throw new IllegalArgumentException("Timestamps " + timestamps.length + " and values " + values.length + " must have the same length");
		}
		this.timestamps = timestamps;
		this.values = values;
	}

	public int size() {
		return timestamps.length;
	}

	public long[] getTimestamps() {
		return timestamps;
	}

	public double[] getValues() {
		return values;
	}

	public long getTimestamp(int i) {
		return timestamps[i];
	}

	public double getValue(int i) {
		return values[i];
	}

	/**
	 * Same timestamps, different values; used after conditioning.
	 * @param newValues Must have the same length
	 * @return ChannelSeries
	 */
	public ChannelSeries withValues(double[] newValues) {
		return new ChannelSeries(timestamps, newValues);
	}

	@SuppressWarnings("unchecked")
	public JSONArray toJSON() {
		JSONArray ret = new JSONArray();
		for(int i = 0; i < timestamps.length; i++) {
			JSONObject point = new JSONObject();
			point.put("timestamp", timestamps[i]);
			point.put("value", values[i]);
			ret.add(point);
		}
		return ret;
	}
}
