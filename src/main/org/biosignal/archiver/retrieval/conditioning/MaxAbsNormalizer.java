package org.biosignal.archiver.retrieval.conditioning;

/**
 * Divide by the largest absolute value; the result is in [-1, 1].
 */
public class MaxAbsNormalizer implements Normalizer {
	public static final String IDENTITY = "max_abs";

	@Override
	public String getIdentity() {
		return IDENTITY;
	}

	@Override
	public double[] normalize(double[] values) {
		if(values == null || values.length == 0) return new double[0];
		double maxAbs = 0;
		for(double value : values) {
			maxAbs = Math.max(maxAbs, Math.abs(value));
		}
		double[] ret = new double[values.length];
		if(maxAbs == 0) return ret;
		for(int i = 0; i < values.length; i++) {
			ret[i] = values[i] / maxAbs;
		}
		return ret;
	}

	@Override
	public String getDescription() {
		return "Max absolute normalization: Scales to [-1, 1] range";
	}
}
