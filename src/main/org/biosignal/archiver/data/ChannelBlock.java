package org.biosignal.archiver.data;

import java.util.Arrays;

/**
 * Timestamps plus one value array per channel; the payload of a chunk before stats are attached.
 */
public class ChannelBlock {
	private final long[] timestamps;
	private final double[][] channels;

	public ChannelBlock(long[] timestamps, double[][] channels) {
		this.timestamps = timestamps;
		this.channels = channels;
	}

	public long[] getTimestamps() {
		return timestamps;
	}

	public double[][] getChannels() {
		return channels;
	}

	public int getSampleCount() {
		return timestamps.length;
	}

	/**
	 * Batches are not guaranteed to be in time order, so this is the smallest timestamp rather than the first.
	 * @return Epoch millis
	 */
	public long getStartTime() {
		return Arrays.stream(timestamps).min().orElse(0);
	}

	public long getEndTime() {
		return Arrays.stream(timestamps).max().orElse(0);
	}
}
