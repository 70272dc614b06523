package org.biosignal.archiver.etl;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.biosignal.archiver.ChunkStore;
import org.biosignal.archiver.common.ArchiverException;
import org.biosignal.archiver.common.ResultCode;
import org.biosignal.archiver.common.TimeUtils;
import org.biosignal.archiver.config.ConfigService;
import org.biosignal.archiver.config.SessionInfo;
import org.biosignal.archiver.config.SessionPersistence;
import org.biosignal.archiver.data.ChannelBlock;
import org.biosignal.archiver.data.ChannelLayout;
import org.biosignal.archiver.data.ChannelStatistics;
import org.biosignal.archiver.data.DataChunk;
import org.biosignal.archiver.data.Sample;

/**
 * Consolidates the provisional chunks of a session into one time sorted chunk when the session ends.
 * This is the ETL step of the archiver; provisional chunks are the source and the consolidated chunk is the destination.
 *
 * The consolidated chunk is written before the provisional chunks are purged.
 * If we crash in between, the next call finds both and resumes at the purge; no data is lost.
 * At most one finalization runs per session; concurrent calls wait on the session lock.
 * @author mshankar
 *
 */
public class SessionFinalizer {
    private static final Logger logger = LogManager.getLogger(SessionFinalizer.class.getName());
    private final ConfigService configService;

    public SessionFinalizer(ConfigService configService) {
        this.configService = configService;
    }

    public FinalizeResult finalizeSession(String sessionId, String userId) throws ArchiverException, IOException {
        SessionPersistence sessions = configService.getSessionPersistence();
        sessions.getSessionForUser(sessionId, userId);
        ReentrantLock lock = configService.getSessionLocks().lock(sessionId);
        try {
            SessionInfo session = sessions.getSessionForUser(sessionId, userId);
            return consolidate(session);
        } finally {
            lock.unlock();
        }
    }

    private FinalizeResult consolidate(SessionInfo session) throws ArchiverException, IOException {
        String sessionId = session.getSessionId();
        ChunkStore chunkStore = configService.getChunkStore();
        FinalizationState state = FinalizationState.PENDING;

        List<DataChunk> provisionalChunks = chunkStore.scanProvisional(sessionId);
        DataChunk existing = chunkStore.getConsolidated(sessionId);

        if (provisionalChunks.isEmpty()) {
            if (existing == null) {
                logger.info("Session " + sessionId + " has no data to finalize");
                return FinalizeResult.noData(session.getStatus());
            }
            if (session.isActive()) {
                // An earlier run purged the provisional chunks but did not get to the session record.
                logger.warn("Session " + sessionId + " was consolidated but not marked completed; completing it now");
                markCompleted(session, existing);
                state = FinalizationState.SESSION_COMPLETED;
            }
            logger.debug("Nothing to finalize for session " + sessionId);
            return new FinalizeResult(ResultCode.OK, "Nothing to finalize; session already consolidated",
                    existing.getSampleCount(), nullToZero(existing.getOriginalChunkCount()), existing.getChunkId(), session.getStatus(), state);
        }

        long startMillis = System.currentTimeMillis();
        DataChunk consolidated = mergeChunks(sessionId, provisionalChunks, existing);
        state = transition(sessionId, state, FinalizationState.SAMPLES_MERGED);

        if (existing != null && existing.getSampleCount() == consolidated.getSampleCount()) {
            logger.info("Resuming finalization of " + sessionId + "; the consolidated chunk is already written");
        } else {
            if (existing != null) {
                logger.warn("Replacing the consolidated chunk for " + sessionId + " with " + existing.getSampleCount()
                        + " samples with one that has " + consolidated.getSampleCount() + " samples");
                chunkStore.deleteConsolidated(sessionId);
            }
            chunkStore.insert(consolidated);
        }
        state = transition(sessionId, state, FinalizationState.CONSOLIDATED_WRITTEN);

        int purged = chunkStore.deleteProvisional(sessionId);
        if (purged != provisionalChunks.size()) {
            logger.warn("Expected to purge " + provisionalChunks.size() + " provisional chunks for " + sessionId + " but purged " + purged);
        }
        state = transition(sessionId, state, FinalizationState.PROVISIONAL_PURGED);

        markCompleted(session, consolidated);
        state = transition(sessionId, state, FinalizationState.SESSION_COMPLETED);

        logger.info("Finalized session " + sessionId + " with " + consolidated.getSampleCount() + " samples from "
                + provisionalChunks.size() + " chunks in " + (System.currentTimeMillis() - startMillis) + "(ms)");
        return new FinalizeResult(ResultCode.OK, "Session finalized", consolidated.getSampleCount(),
                provisionalChunks.size(), consolidated.getChunkId(), session.getStatus(), state);
    }

    /**
     * Merge the provisional chunks in arrival order, then sort by timestamp.
     * The sort is stable so samples with the same timestamp keep their arrival order.
     */
    private DataChunk mergeChunks(String sessionId, List<DataChunk> provisionalChunks, DataChunk existing) {
        int totalSamples = provisionalChunks.stream().mapToInt(DataChunk::getSampleCount).sum();
        List<Sample> allSamples = new ArrayList<Sample>(totalSamples);
        long start = Long.MAX_VALUE;
        long end = Long.MIN_VALUE;
        for (DataChunk chunk : provisionalChunks) {
            allSamples.addAll(ChannelLayout.toSampleMajor(chunk));
            start = Math.min(start, chunk.getStartTime());
            end = Math.max(end, chunk.getEndTime());
        }
        allSamples.sort(ChannelLayout.BY_TIMESTAMP);
        ChannelBlock block = ChannelLayout.toChannelMajor(allSamples);
        logger.debug("Merged " + allSamples.size() + " samples from " + provisionalChunks.size() + " chunks for " + sessionId
                + (existing != null ? " with an existing consolidated chunk" : ""));
        return DataChunk.consolidated(sessionId, start, end, block, ChannelStatistics.computeAll(block.getChannels()), provisionalChunks.size());
    }

    private void markCompleted(SessionInfo session, DataChunk consolidated) throws IOException {
        session.markCompleted(TimeUtils.convertFromEpochMillis(consolidated.getEndTime()), consolidated.getSampleCount());
        configService.getSessionPersistence().putSession(session);
    }

    private static FinalizationState transition(String sessionId, FinalizationState from, FinalizationState to) {
        logger.debug("Finalization of " + sessionId + " moving from " + from + " to " + to);
        return to;
    }

    private static int nullToZero(Integer val) {
        return val == null ? 0 : val;
    }
}
