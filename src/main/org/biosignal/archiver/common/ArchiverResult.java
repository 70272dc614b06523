package org.biosignal.archiver.common;

import org.json.simple.JSONObject;

/**
 * Structured outcome of an operation at the core boundary.
 * Subclasses add the fields specific to their operation in {@link #addFields(JSONObject)}.
 * @author mshankar
 *
 */
public class ArchiverResult {
	private final ResultCode code;
	private final String message;

	public ArchiverResult(ResultCode code, String message) {
		this.code = code;
		this.message = message;
	}

	public boolean isSuccess() {
		return code.isSuccess();
	}

	public ResultCode getCode() {
		return code;
	}

	public String getMessage() {
		return message;
	}

	@SuppressWarnings("unchecked")
	public JSONObject toJSON() {
		JSONObject ret = new JSONObject();
		ret.put("success", isSuccess());
		ret.put("code", code.name());
		ret.put("message", message);
		addFields(ret);
		return ret;
	}

	protected void addFields(JSONObject ret) {
	}

	public static ArchiverResult failure(ArchiverException ex) {
		return new ArchiverResult(ex.getCode(), ex.getMessage());
	}

	@Override
	public String toString() {
		return code + ": " + message;
	}
}
