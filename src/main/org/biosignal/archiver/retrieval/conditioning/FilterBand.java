package org.biosignal.archiver.retrieval.conditioning;

/**
 * Low and high cutoff frequencies (Hz) of a bandpass filter.
 */
public class FilterBand {
	private final double lowCut;
	private final double highCut;

	public FilterBand(double lowCut, double highCut) {
		this.lowCut = lowCut;
		this.highCut = highCut;
	}

	/**
	 * Parse a band from its property form, <code>low,high</code>.
	 * @param bandText For example, <code>20,400</code>
	 * @return FilterBand
	 */
	public static FilterBand parse(String bandText) {
		String[] parts = bandText.split(",");
		if(parts.length != 2) {
			throw new IllegalArgumentException("Expecting a band as low,high; got " + bandText);
		}
		return new FilterBand(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
	}

	public double getLowCut() {
		return lowCut;
	}

	public double getHighCut() {
		return highCut;
	}

	/**
	 * @param sampleRate Sampling rate in Hz
	 * @return true if the band can be applied at this sample rate
	 */
	public boolean isValidFor(double sampleRate) {
		double nyquist = sampleRate / 2;
		return lowCut > 0 && highCut < nyquist && lowCut < highCut;
	}

	@Override
	public String toString() {
		return lowCut + "-" + highCut + "Hz";
	}
}
