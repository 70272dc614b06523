package org.biosignal.archiver.retrieval;

import org.biosignal.archiver.data.ChannelStats;
import org.json.simple.JSONObject;

/**
 * Running combination of per chunk statistics for one channel.
 * Min and max are compared directly; avg and rms are combined weighting each chunk by its sample count,
 * which gives the same result as computing over all the samples (up to the rounding of the per chunk stats).
 * @author mshankar
 *
 */
public class AggregatedChannelStats {
	private double min = Double.POSITIVE_INFINITY;
	private double max = Double.NEGATIVE_INFINITY;
	private double avg = 0;
	private double rms = 0;
	private long count = 0;

	public void add(ChannelStats chunkStats, int chunkCount) {
		if(chunkStats == null || chunkCount <= 0) return;
		min = Math.min(min, chunkStats.getMin());
		max = Math.max(max, chunkStats.getMax());
		long prevCount = count;
		count += chunkCount;
		if(prevCount > 0) {
			avg = (avg * prevCount + chunkStats.getAvg() * chunkCount) / count;
			rms = Math.sqrt((rms * rms * prevCount + chunkStats.getRms() * chunkStats.getRms() * chunkCount) / count);
		} else {
			avg = chunkStats.getAvg();
			rms = chunkStats.getRms();
		}
	}

	/**
	 * @return Min; 0 if nothing has been added.
	 */
	public double getMin() {
		return count == 0 ? 0 : min;
	}

	public double getMax() {
		return count == 0 ? 0 : max;
	}

	public double getAvg() {
		return avg;
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
		ret.put("min", getMin());
		ret.put("max", getMax());
		ret.put("avg", avg);
		ret.put("rms", rms);
		ret.put("count", count);
		return ret;
	}

	@Override
	public String toString() {
		return "min=" + getMin() + " max=" + getMax() + " avg=" + avg + " rms=" + rms + " count=" + count;
	}
}
