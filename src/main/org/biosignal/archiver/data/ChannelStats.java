package org.biosignal.archiver.data;

import org.json.simple.JSONObject;

/**
 * Summary of one channel over one chunk; min, max, mean and root mean square.
 * Values are stored rounded to {@link ChannelStatistics#PRECISION} decimals.
 * @author mshankar
 *
 */
public class ChannelStats {
	public static final ChannelStats ZERO = new ChannelStats(0.0, 0.0, 0.0, 0.0);

	private final double min;
	private final double max;
	private final double avg;
	private final double rms;

	public ChannelStats(double min, double max, double avg, double rms) {
		this.min = min;
		this.max = max;
		this.avg = avg;
		this.rms = rms;
	}

	public double getMin() {
		return min;
	}

	public double getMax() {
		return max;
	}

	public double getAvg() {
		return avg;
	}

	public double getRms() {
		return rms;
	}

	@SuppressWarnings("unchecked")
	public JSONObject toJSON() {
		JSONObject ret = new JSONObject();
		ret.put("min", min);
		ret.put("max", max);
		ret.put("avg", avg);
		ret.put("rms", rms);
		return ret;
	}

	public static ChannelStats fromJSON(JSONObject jsonObj) {
		return new ChannelStats(
				((Number) jsonObj.get("min")).doubleValue(),
				((Number) jsonObj.get("max")).doubleValue(),
				((Number) jsonObj.get("avg")).doubleValue(),
				((Number) jsonObj.get("rms")).doubleValue());
	}

	@Override
	public boolean equals(Object obj) {
		if(this == obj) return true;
		if(!(obj instanceof ChannelStats)) return false;
		ChannelStats other = (ChannelStats) obj;
		return Double.compare(min, other.min) == 0
				&& Double.compare(max, other.max) == 0
				&& Double.compare(avg, other.avg) == 0
				&& Double.compare(rms, other.rms) == 0;
	}

	@Override
	public int hashCode() {
		int result = Double.hashCode(min);
		result = 31 * result + Double.hashCode(max);
		result = 31 * result + Double.hashCode(avg);
		result = 31 * result + Double.hashCode(rms);
		return result;
	}

	@Override
	public String toString() {
		return "min=" + min + " max=" + max + " avg=" + avg + " rms=" + rms;
	}
}
