package org.biosignal.archiver.common;

import org.biosignal.archiver.config.SessionStatus;

/**
 * Thrown when a batch arrives for a session that is neither active nor completed.
 */
public class SessionNotActiveException extends ArchiverException {
	private static final long serialVersionUID = -2113379455360811259L;
	private final SessionStatus status;

	public SessionNotActiveException(String sessionId, SessionStatus status) {
		super(ResultCode.SESSION_NOT_ACTIVE, "Session " + sessionId + " is not active; its status is " + status);
		this.status = status;
	}

	public SessionStatus getStatus() {
		return status;
	}
}
