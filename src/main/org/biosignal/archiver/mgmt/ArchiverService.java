package org.biosignal.archiver.mgmt;

import java.io.IOException;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.biosignal.archiver.common.ArchiverException;
import org.biosignal.archiver.common.ResultCode;
import org.biosignal.archiver.config.ConfigService;
import org.biosignal.archiver.config.SessionInfo;
import org.biosignal.archiver.engine.BatchIngestor;
import org.biosignal.archiver.engine.IngestResult;
import org.biosignal.archiver.engine.UploadBatch;
import org.biosignal.archiver.etl.FinalizeResult;
import org.biosignal.archiver.retrieval.DataQuery;
import org.biosignal.archiver.retrieval.QueryEngine;
import org.biosignal.archiver.retrieval.QueryResult;
import org.biosignal.archiver.storage.DuplicateKeyException;
import org.biosignal.archiver.utils.ui.UploadBatchJSONDecoder;

/**
 * Entry point for the transport layer.
 * Every call returns a structured result with a success flag, a {@link ResultCode} and a message; no exception escapes from here.
 * The caller is expected to have authenticated the user; the user id is used for ownership checks only.
 * @author mshankar
 *
 */
public class ArchiverService {
	private static final Logger logger = LogManager.getLogger(ArchiverService.class.getName());

	private final ConfigService configService;
	private final SessionManager sessionManager;
	private final BatchIngestor ingestor;
	private final QueryEngine queryEngine;

	public ArchiverService(ConfigService configService) {
		this.configService = configService;
		this.sessionManager = new SessionManager(configService);
		this.ingestor = new BatchIngestor(configService);
		this.queryEngine = new QueryEngine(configService);
	}

	public ConfigService getConfigService() {
		return configService;
	}

	public SessionResult createSession(SessionInfo session) {
		String sessionId = session == null ? null : session.getSessionId();
		try {
			return SessionResult.of(sessionManager.createSession(session), "Session created");
		} catch(ArchiverException ex) {
			logger.warn("Cannot create session " + sessionId + ": " + ex.getMessage());
			return SessionResult.failure(ex);
		} catch(Exception ex) {
			logger.error("Exception creating session " + sessionId, ex);
			return SessionResult.failure(codeFor(ex), "Error creating session");
		}
	}

	public SessionResult getSession(String sessionId, String userId) {
		try {
			return SessionResult.of(sessionManager.getSession(sessionId, userId), "Session found");
		} catch(ArchiverException ex) {
			return SessionResult.failure(ex);
		} catch(Exception ex) {
			logger.error("Exception getting session " + sessionId, ex);
			return SessionResult.failure(codeFor(ex), "Error retrieving session");
		}
	}

	public SessionResult listSessions(String userId) {
		try {
			List<SessionInfo> sessions = sessionManager.listSessions(userId);
			return SessionResult.of(sessions);
		} catch(Exception ex) {
			logger.error("Exception listing sessions for " + userId, ex);
			return SessionResult.failure(codeFor(ex), "Error retrieving sessions");
		}
	}

	public IngestResult ingestBatch(UploadBatch batch, String userId) {
		try {
			return ingestor.ingest(batch, userId);
		} catch(ArchiverException ex) {
			logger.warn("Rejected " + batch + ": " + ex.getMessage());
			return IngestResult.failure(ex);
		} catch(Exception ex) {
			logger.error("Exception ingesting " + batch, ex);
			return IngestResult.failure(codeFor(ex), "Error processing batch data: " + ex.getMessage());
		}
	}

	/**
	 * Decode and ingest a batch as uploaded by a device.
	 * @param batchJSON The upload batch as JSON
	 * @param userId Principal
	 * @return IngestResult
	 */
	public IngestResult ingestBatch(String batchJSON, String userId) {
		UploadBatch batch;
		try {
			batch = UploadBatchJSONDecoder.decode(batchJSON);
		} catch(IllegalArgumentException ex) {
			logger.warn("Cannot decode upload batch: " + ex.getMessage());
			return IngestResult.failure(ResultCode.INVALID_REQUEST, ex.getMessage());
		}
		return ingestBatch(batch, userId);
	}

	public FinalizeResult endSession(String sessionId, String userId) {
		try {
			return sessionManager.endSession(sessionId, userId);
		} catch(ArchiverException ex) {
			return FinalizeResult.failure(ex);
		} catch(Exception ex) {
			logger.error("Exception finalizing session " + sessionId, ex);
			return FinalizeResult.failure(codeFor(ex), "Error finalizing session: " + ex.getMessage());
		}
	}

	public SessionResult markAsError(String sessionId, String userId, String reason) {
		try {
			return SessionResult.of(sessionManager.markAsError(sessionId, userId, reason), "Session marked as error");
		} catch(ArchiverException ex) {
			return SessionResult.failure(ex);
		} catch(Exception ex) {
			logger.error("Exception marking session " + sessionId + " as error", ex);
			return SessionResult.failure(codeFor(ex), "Error updating session");
		}
	}

	public DeleteResult deleteSession(String sessionId, String userId) {
		try {
			return DeleteResult.deleted(sessionManager.deleteSession(sessionId, userId));
		} catch(ArchiverException ex) {
			return DeleteResult.failure(ex);
		} catch(Exception ex) {
			logger.error("Exception deleting session " + sessionId, ex);
			return DeleteResult.failure(codeFor(ex), "Error deleting session");
		}
	}

	public ProcessingStats getProcessingStats(String sessionId, String userId) {
		try {
			return sessionManager.getProcessingStats(sessionId, userId);
		} catch(ArchiverException ex) {
			return ProcessingStats.failure(ex);
		} catch(Exception ex) {
			logger.error("Exception getting processing stats for " + sessionId, ex);
			return ProcessingStats.failure(codeFor(ex), "Error retrieving session statistics");
		}
	}

	public QueryResult query(DataQuery query, String userId) {
		if(query == null) {
			return QueryResult.failure(null, ResultCode.INVALID_REQUEST, "A query is required");
		}
		try {
			configService.getSessionPersistence().getSessionForUser(query.getSessionId(), userId);
			return queryEngine.query(query);
		} catch(ArchiverException ex) {
			return QueryResult.failure(query.getSessionId(), ex);
		} catch(Exception ex) {
			logger.error("Exception retrieving data for " + query, ex);
			return QueryResult.failure(query.getSessionId(), codeFor(ex), "Error retrieving session data: " + ex.getMessage());
		}
	}

	private static ResultCode codeFor(Exception ex) {
		if(ex instanceof DuplicateKeyException) return ResultCode.DUPLICATE_KEY;
		if(ex instanceof IllegalArgumentException) return ResultCode.INVALID_REQUEST;
		if(ex instanceof IOException) return ResultCode.STORAGE_ERROR;
		return ResultCode.INTERNAL_ERROR;
	}
}
