package org.biosignal.archiver.utils.ui;

import org.biosignal.archiver.data.ChannelStats;
import org.biosignal.archiver.data.ChunkKind;
import org.biosignal.archiver.data.DataChunk;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.JSONValue;

/**
 * Marshalls a DataChunk to and from the JSON record we persist.
 * Channels that are absent in a projected chunk are written as JSON null.
 * Underlying framework is json-simple.
 * @author mshankar
 *
 */
public class ChunkJSONCodec {

	@SuppressWarnings("unchecked")
	public static JSONObject toJSON(DataChunk chunk) {
		JSONObject ret = new JSONObject();
		ret.put("sessionId", chunk.getSessionId());
		ret.put("chunkIndex", chunk.getChunkIndex());
		ret.put("startTime", chunk.getStartTime());
		ret.put("endTime", chunk.getEndTime());
		ret.put("sampleCount", chunk.getSampleCount());
		ret.put("kind", chunk.getKind().getExternalName());
		if(chunk.getArrivalOrder() != null) {
			ret.put("batchOrder", chunk.getArrivalOrder());
		}
		if(chunk.getOriginalChunkCount() != null) {
			ret.put("originalChunkCount", chunk.getOriginalChunkCount());
		}
		JSONArray timestamps = new JSONArray();
		for(long ts : chunk.getTimestamps()) {
			timestamps.add(ts);
		}
		ret.put("timestamps", timestamps);

		JSONObject channels = new JSONObject();
		JSONObject stats = new JSONObject();
		for(int channel = 0; channel < DataChunk.CHANNEL_COUNT; channel++) {
			String key = "ch" + channel;
			if(!chunk.hasChannel(channel)) {
				channels.put(key, null);
				continue;
			}
			JSONArray values = new JSONArray();
			for(double value : chunk.getChannel(channel)) {
				values.add(value);
			}
			channels.put(key, values);
			stats.put(key, chunk.getStats(channel).toJSON());
		}
		ret.put("channels", channels);
		ret.put("stats", stats);
		return ret;
	}

	public static String toJSONString(DataChunk chunk) {
		return toJSON(chunk).toJSONString();
	}

	public static DataChunk fromJSON(JSONObject jsonObj) {
		String sessionId = (String) jsonObj.get("sessionId");
		int chunkIndex = ((Number) jsonObj.get("chunkIndex")).intValue();
		long startTime = ((Number) jsonObj.get("startTime")).longValue();
		long endTime = ((Number) jsonObj.get("endTime")).longValue();
		int sampleCount = ((Number) jsonObj.get("sampleCount")).intValue();
		ChunkKind kind = ChunkKind.fromExternalName((String) jsonObj.get("kind"));
		Integer arrivalOrder = jsonObj.containsKey("batchOrder") ? ((Number) jsonObj.get("batchOrder")).intValue() : null;
		Integer originalChunkCount = jsonObj.containsKey("originalChunkCount") ? ((Number) jsonObj.get("originalChunkCount")).intValue() : null;

		JSONArray timestampsArray = (JSONArray) jsonObj.get("timestamps");
		long[] timestamps = new long[timestampsArray.size()];
		for(int i = 0; i < timestamps.length; i++) {
			timestamps[i] = ((Number) timestampsArray.get(i)).longValue();
		}

		JSONObject channelsObj = (JSONObject) jsonObj.get("channels");
		JSONObject statsObj = (JSONObject) jsonObj.get("stats");
		double[][] channels = new double[DataChunk.CHANNEL_COUNT][];
		ChannelStats[] stats = new ChannelStats[DataChunk.CHANNEL_COUNT];
		for(int channel = 0; channel < DataChunk.CHANNEL_COUNT; channel++) {
			String key = "ch" + channel;
			JSONArray values = (JSONArray) channelsObj.get(key);
			if(values == null) continue;
			channels[channel] = new double[values.size()];
			for(int i = 0; i < channels[channel].length; i++) {
				channels[channel][i] = ((Number) values.get(i)).doubleValue();
			}
			JSONObject channelStats = (JSONObject) statsObj.get(key);
			stats[channel] = channelStats == null ? ChannelStats.ZERO : ChannelStats.fromJSON(channelStats);
		}
		return new DataChunk(sessionId, chunkIndex, startTime, endTime, sampleCount, timestamps, channels, stats, kind, arrivalOrder, originalChunkCount);
	}

	public static DataChunk fromJSONString(String jsonStr) {
		return fromJSON((JSONObject) JSONValue.parse(jsonStr));
	}
}
