package org.biosignal.archiver.common;

/**
 * Thrown when creating a session whose id is already taken.
 */
public class SessionAlreadyExistsException extends ArchiverException {
	private static final long serialVersionUID = 6622510370938183304L;

	public SessionAlreadyExistsException(String sessionId) {
		super(ResultCode.SESSION_ALREADY_EXISTS, "Session with id " + sessionId + " already exists");
	}
}
