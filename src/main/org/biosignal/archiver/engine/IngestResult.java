package org.biosignal.archiver.engine;

import org.biosignal.archiver.common.ArchiverException;
import org.biosignal.archiver.common.ArchiverResult;
import org.biosignal.archiver.common.ResultCode;
import org.biosignal.archiver.config.SessionStatus;
import org.json.simple.JSONObject;

/**
 * Outcome of ingesting one batch.
 */
public class IngestResult extends ArchiverResult {
	private final int samplesProcessed;
	private final Integer chunkIndex;
	private final String chunkId;
	private final SessionStatus sessionStatus;
	private final boolean provisional;

	public IngestResult(ResultCode code, String message, int samplesProcessed, Integer chunkIndex, String chunkId, SessionStatus sessionStatus, boolean provisional) {
		super(code, message);
		this.samplesProcessed = samplesProcessed;
		this.chunkIndex = chunkIndex;
		this.chunkId = chunkId;
		this.sessionStatus = sessionStatus;
		this.provisional = provisional;
	}

	public static IngestResult stored(int samplesProcessed, int chunkIndex, String chunkId, SessionStatus sessionStatus) {
		return new IngestResult(ResultCode.OK, "Processed " + samplesProcessed + " samples", samplesProcessed, chunkIndex, chunkId, sessionStatus, true);
	}

	public static IngestResult sessionAlreadyCompleted(String sessionId) {
		return new IngestResult(ResultCode.SESSION_ALREADY_COMPLETED, "Session " + sessionId + " already completed", 0, null, null, SessionStatus.COMPLETED, false);
	}

	public static IngestResult failure(ArchiverException ex) {
		return failure(ex.getCode(), ex.getMessage());
	}

	public static IngestResult failure(ResultCode code, String message) {
		return new IngestResult(code, message, 0, null, null, null, false);
	}

	public int getSamplesProcessed() {
		return samplesProcessed;
	}

	public Integer getChunkIndex() {
		return chunkIndex;
	}

	public String getChunkId() {
		return chunkId;
	}

	public SessionStatus getSessionStatus() {
		return sessionStatus;
	}

	public boolean isProvisional() {
		return provisional;
	}

	@SuppressWarnings("unchecked")
	@Override
	protected void addFields(JSONObject ret) {
		ret.put("samplesProcessed", samplesProcessed);
		if(chunkIndex != null) ret.put("chunkIndex", chunkIndex);
		if(chunkId != null) ret.put("chunkId", chunkId);
		if(sessionStatus != null) ret.put("sessionStatus", sessionStatus.getExternalName());
		ret.put("isTemporary", provisional);
	}
}
