package org.biosignal.archiver.retrieval.conditioning;

/**
 * Divide by the root mean square of the sequence.
 */
public class RMSNormalizer implements Normalizer {
	public static final String IDENTITY = "rms";

	@Override
	public String getIdentity() {
		return IDENTITY;
	}

	@Override
	public double[] normalize(double[] values) {
		if(values == null || values.length == 0) return new double[0];
		double sumsq = 0;
		for(double value : values) {
			sumsq += value * value;
		}
		double rms = Math.sqrt(sumsq / values.length);
		double[] ret = new double[values.length];
		if(rms == 0) return ret;
		for(int i = 0; i < values.length; i++) {
			ret[i] = values[i] / rms;
		}
		return ret;
	}

	@Override
	public String getDescription() {
		return "RMS normalization: Divides by root mean square";
	}
}
