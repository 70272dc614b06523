package org.biosignal.archiver.data;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Converts between the sample major layout devices upload and the channel major layout chunks store.
 * Value vectors shorter than {@link DataChunk#CHANNEL_COUNT} are padded with zeros; longer ones are truncated.
 * @author mshankar
 *
 */
public class ChannelLayout {
	public static final Comparator<Sample> BY_TIMESTAMP = Comparator.comparingLong(Sample::getTimestamp);

	public static ChannelBlock toChannelMajor(List<Sample> samples) {
		int sampleCount = samples.size();
		long[] timestamps = new long[sampleCount];
		double[][] channels = new double[DataChunk.CHANNEL_COUNT][sampleCount];
		int i = 0;
		for(Sample sample : samples) {
			timestamps[i] = sample.getTimestamp();
			double[] values = sample.getValues();
			int available = values == null ? 0 : Math.min(values.length, DataChunk.CHANNEL_COUNT);
			for(int channel = 0; channel < available; channel++) {
				channels[channel][i] = values[channel];
			}
			// Arrays start out zeroed, so missing channels are already padded.
			i++;
		}
		return new ChannelBlock(timestamps, channels);
	}

	/**
	 * Inverse of {@link #toChannelMajor(List)}.
	 * The chunk must have all channels; projected chunks cannot be converted back.
	 * @param chunk DataChunk
	 * @return One sample per timestamp in chunk order
	 */
	public static List<Sample> toSampleMajor(DataChunk chunk) {
		for(int channel = 0; channel < DataChunk.CHANNEL_COUNT; channel++) {
			if(!chunk.hasChannel(channel)) {
				throw new IllegalArgumentException("Chunk " + chunk.getChunkId() + " is missing channel ch" + channel);
			}
		}
		long[] timestamps = chunk.getTimestamps();
		List<Sample> ret = new ArrayList<Sample>(timestamps.length);
		for(int i = 0; i < timestamps.length; i++) {
			double[] values = new double[DataChunk.CHANNEL_COUNT];
			for(int channel = 0; channel < DataChunk.CHANNEL_COUNT; channel++) {
				values[channel] = chunk.getChannel(channel)[i];
			}
			ret.add(new Sample(timestamps[i], values, chunk.getSessionId()));
		}
		return ret;
	}
}
