package org.biosignal.archiver.retrieval;

import java.util.Arrays;
import java.util.LinkedHashSet;

import org.apache.commons.lang3.StringUtils;
import org.biosignal.archiver.data.DataChunk;

/**
 * Parses and validates the channels requested in a query.
 */
public class ChannelSelection {
	private static final int[] ALL_CHANNELS = new int[] {0, 1, 2, 3, 4, 5, 6, 7, 8, 9};

	/**
	 * @param channelsArg Comma separated channel numbers, for example <code>0,3,7</code>; blank means all channels.
	 * @return The channel indexes in request order, or null for all channels.
	 * @throws IllegalArgumentException if a channel is not an integer in range or is repeated.
	 */
	public static int[] parse(String channelsArg) {
		if(StringUtils.isBlank(channelsArg)) return null;
		LinkedHashSet<Integer> channels = new LinkedHashSet<Integer>();
		for(String part : channelsArg.split(",")) {
			String trimmed = part.trim();
			int channel;
			try {
				channel = Integer.parseInt(trimmed);
			} catch(NumberFormatException ex) {
				throw new IllegalArgumentException("Channel " + trimmed + " is not an integer", ex);
			}
			validate(channel);
			if(!channels.add(channel)) {
				throw new IllegalArgumentException("Channel " + channel + " is requested more than once");
			}
		}
		return channels.stream().mapToInt(Integer::intValue).toArray();
	}

	public static int[] validate(int[] channels) {
		if(channels == null) return null;
		if(Arrays.stream(channels).distinct().count() != channels.length) {
			throw new IllegalArgumentException("Channels " + Arrays.toString(channels) + " has duplicates");
		}
		for(int channel : channels) {
			validate(channel);
		}
		return channels;
	}

	private static void validate(int channel) {
		if(channel < 0 || channel >= DataChunk.CHANNEL_COUNT) {
			throw new IllegalArgumentException("Channel " + channel + " is not between 0 and " + (DataChunk.CHANNEL_COUNT - 1));
		}
	}

	/**
	 * @param channels Requested channels; null means all.
	 * @return The channels to process
	 */
	public static int[] resolve(int[] channels) {
		return channels == null ? ALL_CHANNELS.clone() : channels;
	}
}
