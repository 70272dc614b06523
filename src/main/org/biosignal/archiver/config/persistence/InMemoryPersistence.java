package org.biosignal.archiver.config.persistence;

import java.io.IOException;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

import org.biosignal.archiver.config.SessionInfo;
import org.biosignal.archiver.config.SessionPersistence;

/**
 * In memory persistence layer for unit tests and for embedding the archiver.
 * Values are copied on the way in and on the way out.
 * @author mshankar
 *
 */
public class InMemoryPersistence implements SessionPersistence {
	private ConcurrentHashMap<String, SessionInfo> sessions = new ConcurrentHashMap<String, SessionInfo>();

	@Override
	public List<String> getSessionKeys() throws IOException {
		return new LinkedList<String>(sessions.keySet());
	}

	@Override
	public SessionInfo getSession(String sessionId) throws IOException {
		SessionInfo session = sessions.get(sessionId);
		return session == null ? null : new SessionInfo(session);
	}

	@Override
	public List<SessionInfo> getSessionsForUser(String userId) throws IOException {
		LinkedList<SessionInfo> ret = new LinkedList<SessionInfo>();
		for(SessionInfo session : sessions.values()) {
			if(session.isOwnedBy(userId)) {
				ret.add(new SessionInfo(session));
			}
		}
		return ret;
	}

	@Override
	public boolean addSession(SessionInfo session) throws IOException {
		return sessions.putIfAbsent(session.getSessionId(), new SessionInfo(session)) == null;
	}

	@Override
	public void putSession(SessionInfo session) throws IOException {
		sessions.put(session.getSessionId(), new SessionInfo(session));
	}

	@Override
	public void deleteSession(String sessionId) throws IOException {
		sessions.remove(sessionId);
	}
}
