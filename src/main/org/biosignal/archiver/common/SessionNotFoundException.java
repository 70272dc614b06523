package org.biosignal.archiver.common;

/**
 * Thrown when there is no session with the given id or the session belongs to somebody else.
 * The two cases are deliberately not distinguished.
 */
public class SessionNotFoundException extends ArchiverException {
	private static final long serialVersionUID = 4270561935284617771L;

	public SessionNotFoundException(String sessionId) {
		super(ResultCode.SESSION_NOT_FOUND, "Session not found or access denied for " + sessionId);
	}
}
