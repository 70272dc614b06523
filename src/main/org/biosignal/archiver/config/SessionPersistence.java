package org.biosignal.archiver.config;

import java.io.IOException;
import java.util.List;

import org.biosignal.archiver.common.SessionNotFoundException;

/**
 * Interface for persisting sessions.
 * Sessions are key/value; the key is the session id and the value is a JSON string of the {@link SessionInfo}.
 * Ownership checks are done by the callers; the persistence layer knows nothing about principals other than what is in the value.
 * @author mshankar
 *
 */
public interface SessionPersistence {

	default void initialize(ConfigService configService) {

	}

	public List<String> getSessionKeys() throws IOException;
	public SessionInfo getSession(String sessionId) throws IOException;
	public List<SessionInfo> getSessionsForUser(String userId) throws IOException;
	/**
	 * Insert a brand new session.
	 * @param session SessionInfo
	 * @return false if a session with this id already exists, in which case nothing is changed.
	 * @throws IOException &emsp;
	 */
	public boolean addSession(SessionInfo session) throws IOException;
	public void putSession(SessionInfo session) throws IOException;
	public void deleteSession(String sessionId) throws IOException;

	/**
	 * Get a session that belongs to this user.
	 * @param sessionId Session
	 * @param userId Principal
	 * @return SessionInfo; never null
	 * @throws SessionNotFoundException if the session does not exist or belongs to somebody else.
	 * @throws IOException &emsp;
	 */
	default SessionInfo getSessionForUser(String sessionId, String userId) throws SessionNotFoundException, IOException {
		SessionInfo session = getSession(sessionId);
		if(session == null || !session.isOwnedBy(userId)) {
			throw new SessionNotFoundException(sessionId);
		}
		return session;
	}
}
