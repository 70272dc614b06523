package org.biosignal.archiver.data;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * A time bounded block of samples for one session in channel major layout.
 * <ul>
 * <li>All channels share the timestamps array; <code>timestamps.length == sampleCount == channels[i].length</code> for every channel present.</li>
 * <li>A chunk projected to a subset of channels has <code>null</code> for the channels (and stats) that were not requested.</li>
 * <li>Provisional chunks carry an arrival order tag; the consolidated chunk carries the number of provisional chunks it replaced.</li>
 * </ul>
 * Chunks are not modified once constructed; the arrays are owned by the chunk and callers should treat them as read only.
 * @author mshankar
 *
 */
public class DataChunk {
	public static final int CHANNEL_COUNT = 10;

	private final String sessionId;
	private final int chunkIndex;
	private final long startTime;
	private final long endTime;
	private final int sampleCount;
	private final long[] timestamps;
	private final double[][] channels;
	private final ChannelStats[] stats;
	private final ChunkKind kind;
	private final Integer arrivalOrder;
	private final Integer originalChunkCount;

	public DataChunk(String sessionId, int chunkIndex, long startTime, long endTime, int sampleCount,
			long[] timestamps, double[][] channels, ChannelStats[] stats, ChunkKind kind,
			Integer arrivalOrder, Integer originalChunkCount) {
		if(sessionId == null || sessionId.isEmpty()) throw new IllegalArgumentException("Chunk needs a session id");
		if(chunkIndex < 0) throw new IllegalArgumentException("Chunk index cannot be negative " + chunkIndex);
		if(kind == null) throw new IllegalArgumentException("Chunk needs a kind");
		if(timestamps == null || timestamps.length != sampleCount) {
			throw new IllegalArgumentException("Timestamps length " + (timestamps == null ? "null" : timestamps.length) + " must match sample count " + sampleCount);
		}
		if(channels == null || channels.length != CHANNEL_COUNT) {
			throw new IllegalArgumentException("Expecting " + CHANNEL_COUNT + " channels");
		}
		if(stats == null || stats.length != CHANNEL_COUNT) {
			throw new IllegalArgumentException("Expecting stats for " + CHANNEL_COUNT + " channels");
		}
		for(int i = 0; i < CHANNEL_COUNT; i++) {
			if(channels[i] != null && channels[i].length != sampleCount) {
				throw new IllegalArgumentException("Channel ch" + i + " has " + channels[i].length + " values; expecting sample count " + sampleCount);
			}
		}
		if(kind == ChunkKind.PROVISIONAL && arrivalOrder == null) {
			throw new IllegalArgumentException("Provisional chunks need an arrival order");
		}
		this.sessionId = sessionId;
		this.chunkIndex = chunkIndex;
		this.startTime = startTime;
		this.endTime = endTime;
		this.sampleCount = sampleCount;
		this.timestamps = timestamps;
		this.channels = channels;
		this.stats = stats;
		this.kind = kind;
		this.arrivalOrder = kind == ChunkKind.PROVISIONAL ? arrivalOrder : null;
		this.originalChunkCount = kind == ChunkKind.CONSOLIDATED ? originalChunkCount : null;
	}

	public static DataChunk provisional(String sessionId, int arrivalOrder, long startTime, long endTime,
			ChannelBlock block, ChannelStats[] stats) {
		return new DataChunk(sessionId, arrivalOrder, startTime, endTime, block.getSampleCount(),
				block.getTimestamps(), block.getChannels(), stats, ChunkKind.PROVISIONAL, arrivalOrder, null);
	}

	public static DataChunk consolidated(String sessionId, long startTime, long endTime,
			ChannelBlock block, ChannelStats[] stats, int originalChunkCount) {
		return new DataChunk(sessionId, 0, startTime, endTime, block.getSampleCount(),
				block.getTimestamps(), block.getChannels(), stats, ChunkKind.CONSOLIDATED, null, originalChunkCount);
	}

	/**
	 * Return a chunk that only has the requested channels; the timestamps are shared.
	 * @param requestedChannels Channel indexes; null means all channels and returns this chunk.
	 * @return DataChunk
	 */
	public DataChunk project(int[] requestedChannels) {
		if(requestedChannels == null) return this;
		double[][] projectedChannels = new double[CHANNEL_COUNT][];
		ChannelStats[] projectedStats = new ChannelStats[CHANNEL_COUNT];
		for(int channel : requestedChannels) {
			projectedChannels[channel] = channels[channel];
			projectedStats[channel] = stats[channel];
		}
		return new DataChunk(sessionId, chunkIndex, startTime, endTime, sampleCount, timestamps,
				projectedChannels, projectedStats, kind, arrivalOrder, originalChunkCount);
	}

	/**
	 * Does this chunk's time interval intersect [start, end]?
	 * @param start Null means open
	 * @param end Null means open
	 * @return boolean
	 */
	public boolean intersects(Long start, Long end) {
		if(start != null && endTime < start) return false;
		if(end != null && startTime > end) return false;
		return true;
	}

	public String getChunkId() {
		return sessionId + "/" + kind.getExternalName() + "/" + chunkIndex;
	}

	public boolean hasChannel(int channel) {
		return channels[channel] != null;
	}

	public String getSessionId() {
		return sessionId;
	}

	public int getChunkIndex() {
		return chunkIndex;
	}

	public long getStartTime() {
		return startTime;
	}

	public long getEndTime() {
		return endTime;
	}

	public int getSampleCount() {
		return sampleCount;
	}

	public long[] getTimestamps() {
		return timestamps;
	}

	public double[] getChannel(int channel) {
		return channels[channel];
	}

	public double[][] getChannels() {
		return channels;
	}

	public ChannelStats getStats(int channel) {
		return stats[channel];
	}

	public ChannelStats[] getStats() {
		return stats;
	}

	public ChunkKind getKind() {
		return kind;
	}

	public boolean isProvisional() {
		return kind == ChunkKind.PROVISIONAL;
	}

	public Integer getArrivalOrder() {
		return arrivalOrder;
	}

	public Integer getOriginalChunkCount() {
		return originalChunkCount;
	}

	@Override
	public String toString() {
		return "DataChunk " + getChunkId() + " with " + sampleCount + " samples from " + startTime + " to " + endTime
				+ (arrivalOrder != null ? " arrival " + arrivalOrder : "")
				+ (originalChunkCount != null ? " consolidated from " + originalChunkCount : "")
				+ " channels " + Arrays.toString(presentChannels());
	}

	private int[] presentChannels() {
		return IntStream.range(0, CHANNEL_COUNT).filter(this::hasChannel).toArray();
	}
}
