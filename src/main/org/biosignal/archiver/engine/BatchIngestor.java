package org.biosignal.archiver.engine;

import java.io.IOException;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.biosignal.archiver.ChunkStore;
import org.biosignal.archiver.common.ArchiverException;
import org.biosignal.archiver.common.SessionNotActiveException;
import org.biosignal.archiver.config.ConfigService;
import org.biosignal.archiver.config.SessionInfo;
import org.biosignal.archiver.config.SessionPersistence;
import org.biosignal.archiver.config.SessionStatus;
import org.biosignal.archiver.data.ChannelBlock;
import org.biosignal.archiver.data.ChannelLayout;
import org.biosignal.archiver.data.ChannelStatistics;
import org.biosignal.archiver.data.ChannelStats;
import org.biosignal.archiver.data.DataChunk;
import org.biosignal.archiver.storage.DuplicateKeyException;

/**
 * Writes one upload batch as a provisional chunk.
 * <ol>
 * <li>The batch is validated before anything is persisted.</li>
 * <li>Late batches for a completed session are discarded and reported as zero samples processed.</li>
 * <li>The next provisional index is the number of provisional chunks the session already has.
 * If another upload raced us to that index, we re-read the count and try again.</li>
 * <li>Updating the session totals happens after the chunk is stored; a failure there is logged and does not fail the ingestion.</li>
 * </ol>
 * Ingestion holds the session lock from the status check until the totals are updated so that it cannot interleave with a finalization.
 * @author mshankar
 *
 */
public class BatchIngestor {
	private static final Logger logger = LogManager.getLogger(BatchIngestor.class.getName());
	public static final String DUPLICATE_KEY_RETRIES_PROPERTY = "org.biosignal.archiver.engine.duplicateKeyRetries";

	private final ConfigService configService;
	private final BatchValidator validator;
	private final int duplicateKeyRetries;

	public BatchIngestor(ConfigService configService) {
		this.configService = configService;
		this.validator = new BatchValidator(configService);
		this.duplicateKeyRetries = configService.getIntProperty(DUPLICATE_KEY_RETRIES_PROPERTY, 3);
	}

	public IngestResult ingest(UploadBatch batch, String userId) throws ArchiverException, IOException {
		validator.validate(batch);
		String sessionId = batch.getSessionId();
		SessionPersistence sessions = configService.getSessionPersistence();
		ChunkStore chunkStore = configService.getChunkStore();
		sessions.getSessionForUser(sessionId, userId);

		ChannelBlock block = ChannelLayout.toChannelMajor(batch.getSamples());
		ChannelStats[] stats = ChannelStatistics.computeAll(block.getChannels());

		DataChunk chunk;
		SessionInfo session;
		ReentrantLock lock = configService.getSessionLocks().lock(sessionId);
		try {
			// Re-read under the lock; a finalization may have completed the session while we waited.
			session = sessions.getSessionForUser(sessionId, userId);
			if(session.getStatus() == SessionStatus.COMPLETED) {
				logger.info("Discarding " + batch + " as the session has already completed");
				return IngestResult.sessionAlreadyCompleted(sessionId);
			}
			if(!session.isActive()) {
				throw new SessionNotActiveException(sessionId, session.getStatus());
			}
			chunk = insertProvisional(chunkStore, sessionId, block, stats);
			updateSession(sessions, session, batch);
		} finally {
			lock.unlock();
		}

		logger.debug("Stored " + chunk);
		return IngestResult.stored(chunk.getSampleCount(), chunk.getChunkIndex(), chunk.getChunkId(), session.getStatus());
	}

	private DataChunk insertProvisional(ChunkStore chunkStore, String sessionId, ChannelBlock block, ChannelStats[] stats) throws IOException {
		int attempt = 0;
		while(true) {
			int index = chunkStore.countProvisional(sessionId);
			DataChunk chunk = DataChunk.provisional(sessionId, index, block.getStartTime(), block.getEndTime(), block, stats);
			try {
				chunkStore.insert(chunk);
				return chunk;
			} catch(DuplicateKeyException ex) {
				attempt++;
				if(attempt > duplicateKeyRetries) {
					logger.error("Giving up on inserting a provisional chunk for " + sessionId + " after " + attempt + " attempts");
					throw ex;
				}
				logger.warn("Provisional index " + index + " for session " + sessionId + " is taken; retrying with a fresh count");
			}
		}
	}

	private void updateSession(SessionPersistence sessions, SessionInfo session, UploadBatch batch) {
		try {
			session.addSamples(batch.getSamples().size());
			if(batch.getDeviceInfo() != null) {
				session.mergeDeviceInfo(batch.getDeviceInfo().toMap());
			}
			sessions.putSession(session);
		} catch(Exception ex) {
			logger.error("Failed to update the totals for session " + session.getSessionId() + "; the chunk has been stored", ex);
		}
	}
}
