package org.biosignal.archiver.retrieval.conditioning;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

/**
 * Subtract the mean and divide by the population standard deviation.
 */
public class ZScoreNormalizer implements Normalizer {
	public static final String IDENTITY = "z_score";

	@Override
	public String getIdentity() {
		return IDENTITY;
	}

	@Override
	public double[] normalize(double[] values) {
		if(values == null || values.length == 0) return new double[0];
		SummaryStatistics stats = new SummaryStatistics();
		for(double value : values) {
			stats.addValue(value);
		}
		double mean = stats.getMean();
		double std = Math.sqrt(stats.getPopulationVariance());
		double[] ret = new double[values.length];
		if(std == 0) return ret;
		for(int i = 0; i < values.length; i++) {
			ret[i] = (values[i] - mean) / std;
		}
		return ret;
	}

	@Override
	public String getDescription() {
		return "Z-Score normalization: Standardizes data (mean=0, std=1)";
	}
}
