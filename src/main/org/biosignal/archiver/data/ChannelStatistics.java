package org.biosignal.archiver.data;

import java.math.BigDecimal;
import java.math.RoundingMode;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

/**
 * Computes the per channel summary stored with each chunk.
 * The RMS is the square root of the mean of the squares; the average is the arithmetic mean.
 * An empty sequence is defined to have all zero statistics.
 * @author mshankar
 *
 */
public class ChannelStatistics {
	/** Number of decimals we round to before storing. */
	public static final int PRECISION = 4;

	public static ChannelStats compute(double[] values) {
		if(values == null || values.length == 0) {
			return ChannelStats.ZERO;
		}
		SummaryStatistics stats = new SummaryStatistics();
		for(double value : values) {
			stats.addValue(value);
		}
		return new ChannelStats(
				round(stats.getMin()),
				round(stats.getMax()),
				round(stats.getMean()),
				round(Math.sqrt(stats.getSumsq() / stats.getN())));
	}

	/**
	 * Compute stats for every channel of a channel major block.
	 * @param channels One array per channel; a null channel gets all zero stats.
	 * @return One ChannelStats per channel
	 */
	public static ChannelStats[] computeAll(double[][] channels) {
		ChannelStats[] ret = new ChannelStats[channels.length];
		for(int i = 0; i < channels.length; i++) {
			ret[i] = compute(channels[i]);
		}
		return ret;
	}

	public static double round(double value) {
		if(Double.isNaN(value) || Double.isInfinite(value)) return value;
		return BigDecimal.valueOf(value).setScale(PRECISION, RoundingMode.HALF_UP).doubleValue();
	}
}
