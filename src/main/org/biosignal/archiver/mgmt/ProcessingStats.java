package org.biosignal.archiver.mgmt;

import org.biosignal.archiver.common.ArchiverException;
import org.biosignal.archiver.common.ArchiverResult;
import org.biosignal.archiver.common.ResultCode;
import org.biosignal.archiver.common.TimeUtils;
import org.biosignal.archiver.config.SessionInfo;
import org.json.simple.JSONObject;

/**
 * What has been stored for a session so far; the session record plus a summary of its chunks.
 * @author mshankar
 *
 */
public class ProcessingStats extends ArchiverResult {
	private final SessionInfo session;
	private final int chunksProcessed;
	private final long samplesProcessed;
	private final Long firstSampleTime;
	private final Long lastSampleTime;

	public ProcessingStats(SessionInfo session, int chunksProcessed, long samplesProcessed, Long firstSampleTime, Long lastSampleTime) {
		super(ResultCode.OK, "Processing stats for " + session.getSessionId());
		this.session = session;
		this.chunksProcessed = chunksProcessed;
		this.samplesProcessed = samplesProcessed;
		this.firstSampleTime = firstSampleTime;
		this.lastSampleTime = lastSampleTime;
	}

	private ProcessingStats(ResultCode code, String message) {
		super(code, message);
		this.session = null;
		this.chunksProcessed = 0;
		this.samplesProcessed = 0;
		this.firstSampleTime = null;
		this.lastSampleTime = null;
	}

	public static ProcessingStats failure(ArchiverException ex) {
		return new ProcessingStats(ex.getCode(), ex.getMessage());
	}

	public static ProcessingStats failure(ResultCode code, String message) {
		return new ProcessingStats(code, message);
	}

	public SessionInfo getSession() {
		return session;
	}

	public int getChunksProcessed() {
		return chunksProcessed;
	}

	public long getSamplesProcessed() {
		return samplesProcessed;
	}

	public Long getFirstSampleTime() {
		return firstSampleTime;
	}

	public Long getLastSampleTime() {
		return lastSampleTime;
	}

	public double getAverageSamplesPerChunk() {
		return chunksProcessed == 0 ? 0 : (double) samplesProcessed / chunksProcessed;
	}

	@SuppressWarnings("unchecked")
	@Override
	protected void addFields(JSONObject ret) {
		if(session == null) return;
		JSONObject sessionObj = new JSONObject();
		sessionObj.put("sessionId", session.getSessionId());
		sessionObj.put("status", session.getStatus().getExternalName());
		sessionObj.put("totalSamples", session.getTotalSamples());
		sessionObj.put("sampleRate", session.getSampleRate());
		sessionObj.put("channelCount", session.getChannelCount());
		sessionObj.put("duration", session.getDurationSeconds());
		ret.put("session", sessionObj);

		JSONObject processing = new JSONObject();
		processing.put("chunksProcessed", chunksProcessed);
		processing.put("samplesProcessed", samplesProcessed);
		processing.put("startTime", firstSampleTime == null ? null : TimeUtils.convertToISO8601String(firstSampleTime));
		processing.put("endTime", lastSampleTime == null ? null : TimeUtils.convertToISO8601String(lastSampleTime));
		processing.put("averageSamplesPerChunk", getAverageSamplesPerChunk());
		ret.put("processing", processing);
	}
}
