package org.biosignal.archiver.engine;

/**
 * What the device says about the batch; declared size and the first and last timestamps.
 * These are checked against the actual samples by {@link BatchValidator}.
 */
public class BatchInfo {
	private int size;
	private long startTime;
	private long endTime;

	public BatchInfo() {
	}

	public BatchInfo(int size, long startTime, long endTime) {
		this.size = size;
		this.startTime = startTime;
		this.endTime = endTime;
	}

	public int getSize() {
		return size;
	}

	public void setSize(int size) {
		this.size = size;
	}

	public long getStartTime() {
		return startTime;
	}

	public void setStartTime(long startTime) {
		this.startTime = startTime;
	}

	public long getEndTime() {
		return endTime;
	}

	public void setEndTime(long endTime) {
		this.endTime = endTime;
	}
}
