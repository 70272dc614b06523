package org.biosignal.archiver.etl;

import org.biosignal.archiver.common.ArchiverException;
import org.biosignal.archiver.common.ArchiverResult;
import org.biosignal.archiver.common.ResultCode;
import org.biosignal.archiver.config.SessionStatus;
import org.json.simple.JSONObject;

/**
 * Outcome of finalizing a session.
 */
public class FinalizeResult extends ArchiverResult {
	private final long samplesProcessed;
	private final int consolidatedChunks;
	private final String chunkId;
	private final SessionStatus sessionStatus;
	private final FinalizationState state;

	public FinalizeResult(ResultCode code, String message, long samplesProcessed, int consolidatedChunks, String chunkId, SessionStatus sessionStatus, FinalizationState state) {
		super(code, message);
		this.samplesProcessed = samplesProcessed;
		this.consolidatedChunks = consolidatedChunks;
		this.chunkId = chunkId;
		this.sessionStatus = sessionStatus;
		this.state = state;
	}

	public static FinalizeResult noData(SessionStatus sessionStatus) {
		return new FinalizeResult(ResultCode.DATA_UNAVAILABLE, "No data to finalize", 0, 0, null, sessionStatus, FinalizationState.PENDING);
	}

	public static FinalizeResult failure(ArchiverException ex) {
		return failure(ex.getCode(), ex.getMessage());
	}

	public static FinalizeResult failure(ResultCode code, String message) {
		return new FinalizeResult(code, message, 0, 0, null, null, null);
	}

	public long getSamplesProcessed() {
		return samplesProcessed;
	}

	public int getConsolidatedChunks() {
		return consolidatedChunks;
	}

	public String getChunkId() {
		return chunkId;
	}

	public SessionStatus getSessionStatus() {
		return sessionStatus;
	}

	public FinalizationState getState() {
		return state;
	}

	@SuppressWarnings("unchecked")
	@Override
	protected void addFields(JSONObject ret) {
		ret.put("samplesProcessed", samplesProcessed);
		ret.put("consolidatedChunks", consolidatedChunks);
		if(chunkId != null) ret.put("chunkId", chunkId);
		if(sessionStatus != null) ret.put("sessionStatus", sessionStatus.getExternalName());
		if(state != null) ret.put("state", state.name());
	}
}
