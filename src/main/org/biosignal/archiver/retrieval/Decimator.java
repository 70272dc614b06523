package org.biosignal.archiver.retrieval;

import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reduces query output to a point budget by keeping every n-th sample of each channel.
 * The stride is <code>ceil(longest/maxPoints)</code> and is the same for all channels, so channels stay aligned.
 * Output values are always a subsequence of the input; nothing is interpolated.
 * @author mshankar
 *
 */
public class Decimator {
	private static final Logger logger = LogManager.getLogger(Decimator.class.getName());

	/**
	 * @param longest Length of the longest series
	 * @param maxPoints Point budget
	 * @return 1 if no decimation is needed
	 */
	public static int computeStride(int longest, int maxPoints) {
		if(maxPoints <= 0) throw new IllegalArgumentException("maxPoints must be positive; got " + maxPoints);
		if(longest <= maxPoints) return 1;
		return (int) Math.ceil((double) longest / maxPoints);
	}

	public static ChannelSeries decimate(ChannelSeries series, int stride) {
		if(stride <= 1) return series;
		int size = (series.size() + stride - 1) / stride;
		long[] timestamps = new long[size];
		double[] values = new double[size];
		for(int i = 0, j = 0; i < series.size(); i += stride, j++) {
			timestamps[j] = series.getTimestamp(i);
			values[j] = series.getValue(i);
		}
		return new ChannelSeries(timestamps, values);
	}

	/**
	 * Decimate all channels in place using one stride.
	 * @param channels Channel number to series
	 * @param maxPoints Point budget
	 * @return The stride used
	 */
	public static int decimate(Map<Integer, ChannelSeries> channels, int maxPoints) {
		int longest = channels.values().stream().mapToInt(ChannelSeries::size).max().orElse(0);
		int stride = computeStride(longest, maxPoints);
		if(stride > 1) {
			logger.debug("Decimating " + longest + " points with a stride of " + stride + " to fit " + maxPoints + " points");
			channels.replaceAll((channel, series) -> decimate(series, stride));
		}
		return stride;
	}
}
