package org.biosignal.archiver.retrieval;

import java.io.IOException;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.biosignal.archiver.config.ConfigService;
import org.biosignal.archiver.data.ChunkKind;
import org.biosignal.archiver.data.DataChunk;
import org.biosignal.archiver.retrieval.conditioning.SignalConditioner;

/**
 * Resolves a query into chunk scans, concatenates the requested channels, combines the chunk stats and decimates to the point budget.
 * Optionally, the full channels are conditioned (filtered and/or normalized) at the session sample rate before they are decimated.
 * Ownership of the session is checked by the caller.
 * @author mshankar
 *
 */
public class QueryEngine {
	private static final Logger logger = LogManager.getLogger(QueryEngine.class.getName());
	public static final String DEFAULT_MAX_POINTS_PROPERTY = "org.biosignal.archiver.retrieval.defaultMaxPoints";
	public static final String MAX_MAX_POINTS_PROPERTY = "org.biosignal.archiver.retrieval.maxMaxPoints";

	private final ConfigService configService;
	private final int defaultMaxPoints;
	private final int maxMaxPoints;
	private final SignalConditioner conditioner;

	public QueryEngine(ConfigService configService) {
		this.configService = configService;
		this.defaultMaxPoints = configService.getIntProperty(DEFAULT_MAX_POINTS_PROPERTY, 10000);
		this.maxMaxPoints = configService.getIntProperty(MAX_MAX_POINTS_PROPERTY, 100000);
		this.conditioner = new SignalConditioner(configService);
	}

	public QueryResult query(DataQuery query) throws IOException {
		int maxPoints = query.getMaxPoints() == null ? defaultMaxPoints : query.getMaxPoints();
		if(maxPoints < 1 || maxPoints > maxMaxPoints) {
			throw new IllegalArgumentException("maxPoints must be between 1 and " + maxMaxPoints + "; got " + maxPoints);
		}
		long startMillis = System.currentTimeMillis();
		String sessionId = query.getSessionId();
		int[] channelsToProcess = ChannelSelection.resolve(query.getChannels());
		List<DataChunk> chunks = dropSupersededChunks(sessionId,
				configService.getChunkStore().scanByTimeRange(sessionId, query.getStartTime(), query.getEndTime(), query.getChannels()));

		QueryResult result = new QueryResult(sessionId);
		result.setChunks(chunks.size());
		result.setTotalSamples(chunks.stream().mapToLong(DataChunk::getSampleCount).sum());
		if(!chunks.isEmpty()) {
			// Provisional chunks may have arrived out of order
			long firstStart = chunks.stream().mapToLong(DataChunk::getStartTime).min().getAsLong();
			long lastEnd = chunks.stream().mapToLong(DataChunk::getEndTime).max().getAsLong();
			result.setTimeRange(firstStart, lastEnd);
		}

		for(int channel : channelsToProcess) {
			int totalForChannel = 0;
			for(DataChunk chunk : chunks) {
				if(chunk.hasChannel(channel)) totalForChannel += chunk.getSampleCount();
			}
			long[] timestamps = new long[totalForChannel];
			double[] values = new double[totalForChannel];
			AggregatedChannelStats stats = new AggregatedChannelStats();
			int offset = 0;
			for(DataChunk chunk : chunks) {
				if(!chunk.hasChannel(channel)) continue;
				int n = chunk.getSampleCount();
				System.arraycopy(chunk.getTimestamps(), 0, timestamps, offset, n);
				System.arraycopy(chunk.getChannel(channel), 0, values, offset, n);
				offset += n;
				stats.add(chunk.getStats(channel), n);
			}
			result.getChannels().put(channel, new ChannelSeries(timestamps, values));
			result.getStats().put(channel, stats);
		}

		if(query.getConditioning() != null) {
			result.getChannels().putAll(conditioner.conditionChannels(result.getChannels(), query.getConditioning()));
			result.setNormalizedStats(SignalConditioner.computeStats(result.getChannels()));
		}

		result.setDecimationStride(Decimator.decimate(result.getChannels(), maxPoints));

		logger.debug("Retrieved " + result.getTotalSamples() + " samples from " + chunks.size() + " chunks for " + query
				+ " in " + (System.currentTimeMillis() - startMillis) + "(ms)");
		return result;
	}

	/**
	 * A finalization that was interrupted after writing the consolidated chunk leaves the provisional chunks behind.
	 * Provisional chunks that were merged into the consolidated chunk are skipped; ones that arrived after the merge are kept.
	 */
	private static List<DataChunk> dropSupersededChunks(String sessionId, List<DataChunk> chunks) {
		DataChunk consolidated = chunks.stream().filter(chunk -> chunk.getKind() == ChunkKind.CONSOLIDATED).findFirst().orElse(null);
		if(consolidated == null) {
			return chunks;
		}
		int mergedCount = consolidated.getOriginalChunkCount() == null ? Integer.MAX_VALUE : consolidated.getOriginalChunkCount();
		List<DataChunk> ret = chunks.stream()
				.filter(chunk -> !chunk.isProvisional() || chunk.getArrivalOrder() >= mergedCount)
				.collect(Collectors.toList());
		if(ret.size() != chunks.size()) {
			logger.warn("Session " + sessionId + " has both consolidated and provisional chunks; skipping " + (chunks.size() - ret.size()) + " provisional chunks that were already merged");
		}
		return ret;
	}
}
