package org.biosignal.archiver.common;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Advisory per session locks.
 * Finalization of a session holds the session's lock so that at most one consolidation is in flight per session.
 * Locks are created lazily and are released with the session (see {@link #forget(String)}).
 * @author mshankar
 *
 */
public class SessionLocks {
	private static final Logger logger = LogManager.getLogger(SessionLocks.class.getName());
	private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<String, ReentrantLock>();

	public ReentrantLock getLock(String sessionId) {
		return locks.computeIfAbsent(sessionId, k -> new ReentrantLock());
	}

	/**
	 * Acquire the lock for this session; if some other thread is finalizing the same session, we wait for it.
	 * @param sessionId The session id
	 * @return The lock, already held by the caller
	 */
	public ReentrantLock lock(String sessionId) {
		ReentrantLock lock = getLock(sessionId);
		if(lock.isLocked() && !lock.isHeldByCurrentThread()) {
			logger.info("Waiting for another finalization of session " + sessionId + " to complete");
		}
		lock.lock();
		return lock;
	}

	public boolean isLocked(String sessionId) {
		ReentrantLock lock = locks.get(sessionId);
		return lock != null && lock.isLocked();
	}

	/**
	 * Drop the lock object for a session that has been deleted.
	 * @param sessionId The session id
	 */
	public void forget(String sessionId) {
		locks.remove(sessionId);
	}
}
