package org.biosignal.archiver.retrieval.conditioning;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.json.simple.JSONObject;

/**
 * Summary of a conditioned series; unlike the stored chunk stats, these are not rounded and include the population standard deviation.
 */
public class SeriesStats {
	private final double min;
	private final double max;
	private final double mean;
	private final double std;
	private final double rms;
	private final long count;

	private SeriesStats(double min, double max, double mean, double std, double rms, long count) {
		this.min = min;
		this.max = max;
		this.mean = mean;
		this.std = std;
		this.rms = rms;
		this.count = count;
	}

	public static SeriesStats compute(double[] values) {
		if(values == null || values.length == 0) {
			return new SeriesStats(0, 0, 0, 0, 0, 0);
		}
		SummaryStatistics stats = new SummaryStatistics();
		for(double value : values) {
			stats.addValue(value);
		}
		return new SeriesStats(stats.getMin(), stats.getMax(), stats.getMean(),
				Math.sqrt(stats.getPopulationVariance()), Math.sqrt(stats.getSumsq() / stats.getN()), stats.getN());
	}

	public double getMin() {
		return min;
	}

	public double getMax() {
		return max;
	}

	public double getMean() {
		return mean;
	}

	public double getStd() {
		return std;
	}

	public double getRms() {
		return rms;
	}

	public long getCount() {
		return count;
	}

	@SuppressWarnings("unchecked")
	public JSONObject toJSON() {
		JSONObject ret = new JSONObject();
		ret.put("min", min);
		ret.put("max", max);
		ret.put("mean", mean);
		ret.put("avg", mean);
		ret.put("std", std);
		ret.put("rms", rms);
		ret.put("count", count);
		return ret;
	}
}
