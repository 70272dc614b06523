package org.biosignal.archiver.data;

/**
 * One multi channel sample as sent by the device; sample major layout.
 */
public class Sample {
	private final long timestamp;
	private final double[] values;
	private final String sessionId;

	public Sample(long timestamp, double[] values, String sessionId) {
		this.timestamp = timestamp;
		this.values = values;
		this.sessionId = sessionId;
	}

	public long getTimestamp() {
		return timestamp;
	}

	public double[] getValues() {
		return values;
	}

	public String getSessionId() {
		return sessionId;
	}
}
