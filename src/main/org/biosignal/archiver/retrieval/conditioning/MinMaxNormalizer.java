package org.biosignal.archiver.retrieval.conditioning;

import java.util.Arrays;

/**
 * Linear rescale to a target range, [0, 1] unless specified as <code>min_max_low_high</code>.
 * If all values are the same, everything maps to the low end of the range.
 */
public class MinMaxNormalizer implements Normalizer {
	public static final String IDENTITY = "min_max";
	private double rangeLow = 0.0;
	private double rangeHigh = 1.0;

	public MinMaxNormalizer() {
	}

	public MinMaxNormalizer(double rangeLow, double rangeHigh) {
		this.rangeLow = rangeLow;
		this.rangeHigh = rangeHigh;
	}

	@Override
	public String getIdentity() {
		return IDENTITY;
	}

	@Override
	public void initialize(String userarg) {
		double[] params = NormalizerArgs.parse(userarg, IDENTITY);
		if(params.length == 2) {
			rangeLow = params[0];
			rangeHigh = params[1];
		} else if(params.length != 0) {
			throw new IllegalArgumentException("min_max takes a low and a high; got " + userarg);
		}
	}

	@Override
	public double[] normalize(double[] values) {
		if(values == null || values.length == 0) return new double[0];
		double min = Arrays.stream(values).min().getAsDouble();
		double max = Arrays.stream(values).max().getAsDouble();
		double[] ret = new double[values.length];
		if(max == min) {
			Arrays.fill(ret, rangeLow);
			return ret;
		}
		double scale = rangeHigh - rangeLow;
		for(int i = 0; i < values.length; i++) {
			ret[i] = (values[i] - min) / (max - min) * scale + rangeLow;
		}
		return ret;
	}

	@Override
	public String getDescription() {
		return "Min-Max normalization: Scales data to [" + rangeLow + ", " + rangeHigh + "] range";
	}
}
