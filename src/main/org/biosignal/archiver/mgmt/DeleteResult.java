package org.biosignal.archiver.mgmt;

import org.biosignal.archiver.common.ArchiverException;
import org.biosignal.archiver.common.ArchiverResult;
import org.biosignal.archiver.common.ResultCode;
import org.json.simple.JSONObject;

public class DeleteResult extends ArchiverResult {
	private final int deletedChunks;

	public DeleteResult(ResultCode code, String message, int deletedChunks) {
		super(code, message);
		this.deletedChunks = deletedChunks;
	}

	public static DeleteResult deleted(int deletedChunks) {
		return new DeleteResult(ResultCode.OK, "Session and all associated data deleted successfully", deletedChunks);
	}

	public static DeleteResult failure(ArchiverException ex) {
		return new DeleteResult(ex.getCode(), ex.getMessage(), 0);
	}

	public static DeleteResult failure(ResultCode code, String message) {
		return new DeleteResult(code, message, 0);
	}

	public int getDeletedChunks() {
		return deletedChunks;
	}

	@SuppressWarnings("unchecked")
	@Override
	protected void addFields(JSONObject ret) {
		ret.put("deletedChunks", deletedChunks);
	}
}
