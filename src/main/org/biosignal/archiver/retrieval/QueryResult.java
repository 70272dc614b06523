package org.biosignal.archiver.retrieval;

import java.util.LinkedHashMap;
import java.util.Map;

import org.biosignal.archiver.common.ArchiverException;
import org.biosignal.archiver.common.ArchiverResult;
import org.biosignal.archiver.common.ResultCode;
import org.biosignal.archiver.retrieval.conditioning.SeriesStats;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * The data for a query; per channel series and aggregated stats, keyed by channel number in request order.
 * Normalized stats are present only if the query asked for conditioning.
 * @author mshankar
 *
 */
public class QueryResult extends ArchiverResult {
	private final String sessionId;
	private Long firstChunkStart;
	private Long lastChunkEnd;
	private int chunks;
	private long totalSamples;
	private int decimationStride = 1;
	private final LinkedHashMap<Integer, ChannelSeries> channels = new LinkedHashMap<Integer, ChannelSeries>();
	private final LinkedHashMap<Integer, AggregatedChannelStats> stats = new LinkedHashMap<Integer, AggregatedChannelStats>();
	private Map<Integer, SeriesStats> normalizedStats;

	public QueryResult(String sessionId) {
		super(ResultCode.OK, "Data retrieved");
		this.sessionId = sessionId;
	}

	private QueryResult(ResultCode code, String message, String sessionId) {
		super(code, message);
		this.sessionId = sessionId;
	}

	public static QueryResult failure(String sessionId, ArchiverException ex) {
		return new QueryResult(ex.getCode(), ex.getMessage(), sessionId);
	}

	public static QueryResult failure(String sessionId, ResultCode code, String message) {
		return new QueryResult(code, message, sessionId);
	}

	public String getSessionId() {
		return sessionId;
	}

	public Long getFirstChunkStart() {
		return firstChunkStart;
	}

	public Long getLastChunkEnd() {
		return lastChunkEnd;
	}

	void setTimeRange(Long firstChunkStart, Long lastChunkEnd) {
		this.firstChunkStart = firstChunkStart;
		this.lastChunkEnd = lastChunkEnd;
	}

	public int getChunks() {
		return chunks;
	}

	void setChunks(int chunks) {
		this.chunks = chunks;
	}

	public long getTotalSamples() {
		return totalSamples;
	}

	void setTotalSamples(long totalSamples) {
		this.totalSamples = totalSamples;
	}

	public int getDecimationStride() {
		return decimationStride;
	}

	void setDecimationStride(int decimationStride) {
		this.decimationStride = decimationStride;
	}

	public Map<Integer, ChannelSeries> getChannels() {
		return channels;
	}

	public ChannelSeries getChannel(int channel) {
		return channels.get(channel);
	}

	public Map<Integer, AggregatedChannelStats> getStats() {
		return stats;
	}

	public AggregatedChannelStats getStats(int channel) {
		return stats.get(channel);
	}

	public Map<Integer, SeriesStats> getNormalizedStats() {
		return normalizedStats;
	}

	void setNormalizedStats(Map<Integer, SeriesStats> normalizedStats) {
		this.normalizedStats = normalizedStats;
	}

	@SuppressWarnings("unchecked")
	@Override
	protected void addFields(JSONObject ret) {
		if(!isSuccess()) return;
		JSONObject data = new JSONObject();
		data.put("sessionId", sessionId);
		JSONArray timeRange = new JSONArray();
		timeRange.add(firstChunkStart);
		timeRange.add(lastChunkEnd);
		data.put("timeRange", timeRange);
		data.put("chunks", chunks);
		data.put("totalSamples", totalSamples);
		JSONObject channelsObj = new JSONObject();
		for(Map.Entry<Integer, ChannelSeries> entry : channels.entrySet()) {
			channelsObj.put("ch" + entry.getKey(), entry.getValue().toJSON());
		}
		data.put("channels", channelsObj);
		JSONObject statsObj = new JSONObject();
		for(Map.Entry<Integer, AggregatedChannelStats> entry : stats.entrySet()) {
			statsObj.put("ch" + entry.getKey(), entry.getValue().toJSON());
		}
		data.put("stats", statsObj);
		if(normalizedStats != null) {
			JSONObject normalizedObj = new JSONObject();
			for(Map.Entry<Integer, SeriesStats> entry : normalizedStats.entrySet()) {
				normalizedObj.put("ch" + entry.getKey(), entry.getValue().toJSON());
			}
			data.put("normalizedStats", normalizedObj);
		}
		ret.put("data", data);
	}
}
