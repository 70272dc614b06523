package org.biosignal.archiver.mgmt;

import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.biosignal.archiver.ChunkStore;
import org.biosignal.archiver.common.ArchiverException;
import org.biosignal.archiver.common.ResultCode;
import org.biosignal.archiver.common.SessionAlreadyExistsException;
import org.biosignal.archiver.common.SessionNotActiveException;
import org.biosignal.archiver.common.TimeUtils;
import org.biosignal.archiver.config.ConfigService;
import org.biosignal.archiver.config.SessionInfo;
import org.biosignal.archiver.config.SessionPersistence;
import org.biosignal.archiver.config.SessionStatus;
import org.biosignal.archiver.data.DataChunk;
import org.biosignal.archiver.etl.FinalizeResult;
import org.biosignal.archiver.etl.SessionFinalizer;

/**
 * Lifecycle of sessions; create, look up, end, mark as failed and delete.
 * Ownership is checked on every call; a session that belongs to somebody else is reported as not found.
 * @author mshankar
 *
 */
public class SessionManager {
	private static final Logger logger = LogManager.getLogger(SessionManager.class.getName());
	public static final int MIN_SESSION_ID_LENGTH = 10;
	public static final int MAX_SESSION_ID_LENGTH = 100;
	public static final int MAX_SAMPLE_RATE = 10000;
	public static final String SESSION_TYPE_RAW = "raw";
	public static final String SESSION_TYPE_NORMALIZED = "normalized";

	private final ConfigService configService;
	private final SessionFinalizer finalizer;

	public SessionManager(ConfigService configService) {
		this.configService = configService;
		this.finalizer = new SessionFinalizer(configService);
	}

	/**
	 * Register a new session for the session's user.
	 * The session starts out active with no samples; the sample rate defaults to 1000Hz.
	 * @param session The new session
	 * @return The stored session
	 * @throws ArchiverException if the session is not valid or the id is taken.
	 * @throws IOException &emsp;
	 */
	public SessionInfo createSession(SessionInfo session) throws ArchiverException, IOException {
		validateNewSession(session);
		SessionInfo toStore = new SessionInfo(session);
		toStore.setStatus(SessionStatus.ACTIVE);
		toStore.setTotalSamples(0);
		toStore.setEndTime(null);
		toStore.setChannelCount(DataChunk.CHANNEL_COUNT);
		if(toStore.getSampleRate() <= 0) toStore.setSampleRate(SessionInfo.DEFAULT_SAMPLE_RATE);
		if(toStore.getStartTime() == null) toStore.setStartTime(TimeUtils.now());
		if(toStore.getCreationTime() == null) toStore.setCreationTime(TimeUtils.now());
		if(!configService.getSessionPersistence().addSession(toStore)) {
			throw new SessionAlreadyExistsException(session.getSessionId());
		}
		logger.info("Created session " + toStore.getSessionId() + " for user " + toStore.getUserId());
		return toStore;
	}

	private void validateNewSession(SessionInfo session) throws ArchiverException {
		if(session == null) {
			throw new ArchiverException(ResultCode.INVALID_REQUEST, "Session details are required");
		}
		String sessionId = session.getSessionId();
		if(StringUtils.isBlank(sessionId) || sessionId.length() < MIN_SESSION_ID_LENGTH || sessionId.length() > MAX_SESSION_ID_LENGTH) {
			throw new ArchiverException(ResultCode.INVALID_REQUEST, "Session ID must be between " + MIN_SESSION_ID_LENGTH + "-" + MAX_SESSION_ID_LENGTH + " characters");
		}
		if(StringUtils.isBlank(session.getUserId())) {
			throw new ArchiverException(ResultCode.INVALID_REQUEST, "Session " + sessionId + " does not have a user");
		}
		if(StringUtils.isBlank(session.getDeviceId())) {
			throw new ArchiverException(ResultCode.INVALID_REQUEST, "Device ID is required");
		}
		if(session.getSampleRate() > MAX_SAMPLE_RATE) {
			throw new ArchiverException(ResultCode.INVALID_REQUEST, "Sample rate must be between 1-" + MAX_SAMPLE_RATE);
		}
		String sessionType = session.getSessionType();
		if(sessionType != null && !sessionType.equals(SESSION_TYPE_RAW) && !sessionType.equals(SESSION_TYPE_NORMALIZED)) {
			throw new ArchiverException(ResultCode.INVALID_REQUEST, "Session type must be " + SESSION_TYPE_RAW + " or " + SESSION_TYPE_NORMALIZED);
		}
	}

	public SessionInfo getSession(String sessionId, String userId) throws ArchiverException, IOException {
		return configService.getSessionPersistence().getSessionForUser(sessionId, userId);
	}

	/**
	 * @param userId Principal
	 * @return The user's sessions, most recently started first.
	 * @throws IOException &emsp;
	 */
	public List<SessionInfo> listSessions(String userId) throws IOException {
		List<SessionInfo> sessions = configService.getSessionPersistence().getSessionsForUser(userId);
		sessions.sort(Comparator.comparing(SessionInfo::getStartTime, Comparator.nullsLast(Comparator.reverseOrder())));
		return sessions;
	}

	/**
	 * End the session; this consolidates the provisional chunks and marks the session completed.
	 * @param sessionId Session
	 * @param userId Principal
	 * @return FinalizeResult
	 * @throws ArchiverException &emsp;
	 * @throws IOException &emsp;
	 */
	public FinalizeResult endSession(String sessionId, String userId) throws ArchiverException, IOException {
		return finalizer.finalizeSession(sessionId, userId);
	}

	/**
	 * Move an active session to the error state; for example, when the device reports a fatal problem.
	 * Chunks already stored are kept.
	 * @param sessionId Session
	 * @param userId Principal
	 * @param reason Error message
	 * @return The updated session
	 * @throws ArchiverException &emsp;
	 * @throws IOException &emsp;
	 */
	public SessionInfo markAsError(String sessionId, String userId, String reason) throws ArchiverException, IOException {
		SessionPersistence sessions = configService.getSessionPersistence();
		ReentrantLock lock = configService.getSessionLocks().lock(sessionId);
		try {
			SessionInfo session = sessions.getSessionForUser(sessionId, userId);
			if(!session.isActive()) {
				throw new SessionNotActiveException(sessionId, session.getStatus());
			}
			session.markAsError(reason);
			sessions.putSession(session);
			logger.warn("Session " + sessionId + " marked as error: " + reason);
			return session;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Remove the session and all its chunks.
	 * @param sessionId Session
	 * @param userId Principal
	 * @return The number of chunks removed
	 * @throws ArchiverException &emsp;
	 * @throws IOException &emsp;
	 */
	public int deleteSession(String sessionId, String userId) throws ArchiverException, IOException {
		SessionPersistence sessions = configService.getSessionPersistence();
		sessions.getSessionForUser(sessionId, userId);
		int deletedChunks;
		ReentrantLock lock = configService.getSessionLocks().lock(sessionId);
		try {
			sessions.getSessionForUser(sessionId, userId);
			deletedChunks = configService.getChunkStore().deleteAll(sessionId);
			sessions.deleteSession(sessionId);
		} finally {
			lock.unlock();
		}
		configService.getSessionLocks().forget(sessionId);
		logger.info("Deleted session " + sessionId + " and " + deletedChunks + " chunks");
		return deletedChunks;
	}

	public ProcessingStats getProcessingStats(String sessionId, String userId) throws ArchiverException, IOException {
		SessionInfo session = configService.getSessionPersistence().getSessionForUser(sessionId, userId);
		ChunkStore chunkStore = configService.getChunkStore();
		List<DataChunk> chunks = chunkStore.scanByTimeRange(sessionId, null, null, new int[0]);
		long samples = 0;
		Long first = null;
		Long last = null;
		for(DataChunk chunk : chunks) {
			samples += chunk.getSampleCount();
			first = first == null ? chunk.getStartTime() : Math.min(first, chunk.getStartTime());
			last = last == null ? chunk.getEndTime() : Math.max(last, chunk.getEndTime());
		}
		return new ProcessingStats(session, chunks.size(), samples, first, last);
	}
}
