package org.biosignal.archiver.common;

/**
 * Outcome codes reported across the core boundary.
 * Callers map these to their transport level status codes.
 */
public enum ResultCode {
	OK(true),
	/** A late batch for a completed session; reported as zero samples processed. */
	SESSION_ALREADY_COMPLETED(false),
	/** Finalize was called on a session with no provisional chunks. */
	DATA_UNAVAILABLE(true),
	SESSION_NOT_FOUND(false),
	SESSION_NOT_ACTIVE(false),
	SESSION_ALREADY_EXISTS(false),
	BATCH_INTEGRITY_ERROR(false),
	INVALID_REQUEST(false),
	DUPLICATE_KEY(false),
	STORAGE_ERROR(false),
	INTERNAL_ERROR(false);

	private final boolean success;

	private ResultCode(boolean success) {
		this.success = success;
	}

	public boolean isSuccess() {
		return success;
	}
}
