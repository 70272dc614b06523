package org.biosignal.archiver.retrieval.conditioning;

import java.util.Arrays;

/**
 * Rescale between two percentiles of the data and clip to [0, 1]; robust to outliers.
 * The percentiles default to 5 and 95 and can be specified as <code>percentile_lower_upper</code>.
 * The bounds are picked from a sorted copy at <code>floor(n*lower/100)</code> and <code>ceil(n*upper/100)-1</code>.
 */
public class PercentileNormalizer implements Normalizer {
	public static final String IDENTITY = "percentile";
	private double lowerPercentile;
	private double upperPercentile;

	public PercentileNormalizer() {
		this(5, 95);
	}

	public PercentileNormalizer(double lowerPercentile, double upperPercentile) {
		this.lowerPercentile = lowerPercentile;
		this.upperPercentile = upperPercentile;
	}

	@Override
	public String getIdentity() {
		return IDENTITY;
	}

	@Override
	public void initialize(String userarg) {
		double[] params = NormalizerArgs.parse(userarg, IDENTITY);
		if(params.length == 2) {
			setPercentiles(params[0], params[1]);
		} else if(params.length != 0) {
			throw new IllegalArgumentException("percentile takes a lower and an upper percentile; got " + userarg);
		}
	}

	void setPercentiles(double lower, double upper) {
		if(lower < 0 || upper > 100 || lower >= upper) {
			throw new IllegalArgumentException("Invalid percentiles " + lower + " and " + upper);
		}
		this.lowerPercentile = lower;
		this.upperPercentile = upper;
	}

	@Override
	public double[] normalize(double[] values) {
		if(values == null || values.length == 0) return new double[0];
		double[] sorted = values.clone();
		Arrays.sort(sorted);
		int n = sorted.length;
		int lowerIdx = (int) Math.floor(n * lowerPercentile / 100);
		int upperIdx = (int) Math.ceil(n * upperPercentile / 100) - 1;
		lowerIdx = Math.max(0, Math.min(n - 1, lowerIdx));
		upperIdx = Math.max(0, Math.min(n - 1, upperIdx));
		double pLower = sorted[lowerIdx];
		double pUpper = sorted[upperIdx];
		double[] ret = new double[values.length];
		if(pUpper == pLower) return ret;
		for(int i = 0; i < values.length; i++) {
			double normalized = (values[i] - pLower) / (pUpper - pLower);
			ret[i] = Math.max(0, Math.min(1, normalized));
		}
		return ret;
	}

	@Override
	public String getDescription() {
		return "Percentile normalization: Robust to outliers, scales to [0, 1]";
	}
}
