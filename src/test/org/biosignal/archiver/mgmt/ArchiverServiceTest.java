package org.biosignal.archiver.mgmt;

import java.io.IOException;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.biosignal.archiver.common.ResultCode;
import org.biosignal.archiver.config.ConfigServiceForTests;
import org.biosignal.archiver.config.SessionInfo;
import org.biosignal.archiver.config.persistence.InMemoryPersistence;
import org.biosignal.archiver.data.DataChunk;
import org.biosignal.archiver.engine.BatchInfo;
import org.biosignal.archiver.engine.IngestResult;
import org.biosignal.archiver.engine.UploadBatch;
import org.biosignal.archiver.etl.FinalizeResult;
import org.biosignal.archiver.retrieval.DataQuery;
import org.biosignal.archiver.retrieval.QueryResult;
import org.biosignal.archiver.storage.InMemoryChunkStore;
import org.biosignal.archiver.utils.simulation.SimulatedBatches;
import org.json.simple.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Every outcome at the service boundary is a structured result.
 * @author mshankar
 *
 */
public class ArchiverServiceTest {
	private static final Logger logger = LogManager.getLogger(ArchiverServiceTest.class.getName());
	private ConfigServiceForTests configService;
	private ArchiverService service;
	private String sessionId;

	@BeforeEach
	public void setUp() {
		configService = new ConfigServiceForTests();
		service = new ArchiverService(configService);
		SessionResult created = service.createSession(SimulatedBatches.newSession("service"));
		Assertions.assertTrue(created.isSuccess());
		sessionId = created.getSession().getSessionId();
	}

	@Test
	public void testRecordingLifecycle() {
		for(int i = 0; i < 4; i++) {
			IngestResult result = service.ingestBatch(SimulatedBatches.batch(sessionId, i * 100, 100), ConfigServiceForTests.TEST_USER);
			Assertions.assertTrue(result.isSuccess(), result.getMessage());
		}
		QueryResult during = service.query(new DataQuery(sessionId).withChannels("0"), ConfigServiceForTests.TEST_USER);
		Assertions.assertEquals(4, during.getChunks());

		FinalizeResult finalized = service.endSession(sessionId, ConfigServiceForTests.TEST_USER);
		logger.info(finalized.toJSON().toJSONString());
		Assertions.assertEquals(ResultCode.OK, finalized.getCode());
		Assertions.assertEquals(400, finalized.getSamplesProcessed());

		IngestResult late = service.ingestBatch(SimulatedBatches.batch(sessionId, 1000, 10), ConfigServiceForTests.TEST_USER);
		Assertions.assertEquals(ResultCode.SESSION_ALREADY_COMPLETED, late.getCode());
		Assertions.assertEquals(0L, ((Number) late.toJSON().get("samplesProcessed")).longValue());

		QueryResult after = service.query(new DataQuery(sessionId).withChannels("0"), ConfigServiceForTests.TEST_USER);
		Assertions.assertEquals(1, after.getChunks());
		Assertions.assertEquals(400, after.getChannel(0).size());

		ProcessingStats stats = service.getProcessingStats(sessionId, ConfigServiceForTests.TEST_USER);
		JSONObject statsJSON = stats.toJSON();
		Assertions.assertEquals("completed", ((JSONObject) statsJSON.get("session")).get("status"));

		DeleteResult deleted = service.deleteSession(sessionId, ConfigServiceForTests.TEST_USER);
		Assertions.assertTrue(deleted.isSuccess());
		Assertions.assertEquals(1, deleted.getDeletedChunks());
		Assertions.assertEquals(ResultCode.SESSION_NOT_FOUND, service.getSession(sessionId, ConfigServiceForTests.TEST_USER).getCode());
	}

	@Test
	public void testIngestFailures() {
		IngestResult unknown = service.ingestBatch(SimulatedBatches.batch("ArchUnitTest_nosuchsession", 0, 10), ConfigServiceForTests.TEST_USER);
		Assertions.assertEquals(ResultCode.SESSION_NOT_FOUND, unknown.getCode());
		Assertions.assertFalse(unknown.isSuccess());

		IngestResult foreign = service.ingestBatch(SimulatedBatches.batch(sessionId, 0, 10), "someotheruser");
		Assertions.assertEquals(ResultCode.SESSION_NOT_FOUND, foreign.getCode());

		UploadBatch bad = new UploadBatch(sessionId, SimulatedBatches.samples(sessionId, 0, 10, 10), null, new BatchInfo(11, 0, 0));
		IngestResult integrity = service.ingestBatch(bad, ConfigServiceForTests.TEST_USER);
		Assertions.assertEquals(ResultCode.BATCH_INTEGRITY_ERROR, integrity.getCode());
		Assertions.assertEquals(Boolean.FALSE, integrity.toJSON().get("success"));

		IngestResult garbage = service.ingestBatch("{\"sessionId\": 42", ConfigServiceForTests.TEST_USER);
		Assertions.assertEquals(ResultCode.INVALID_REQUEST, garbage.getCode());

		service.markAsError(sessionId, ConfigServiceForTests.TEST_USER, "Device reset");
		IngestResult notActive = service.ingestBatch(SimulatedBatches.batch(sessionId, 0, 10), ConfigServiceForTests.TEST_USER);
		Assertions.assertEquals(ResultCode.SESSION_NOT_ACTIVE, notActive.getCode());
	}

	@Test
	public void testIngestJSON() {
		String json = SimulatedBatches.toUploadJSON(SimulatedBatches.batch(sessionId, 0, 50)).toJSONString();
		IngestResult result = service.ingestBatch(json, ConfigServiceForTests.TEST_USER);
		Assertions.assertTrue(result.isSuccess(), result.getMessage());
		JSONObject resultJSON = result.toJSON();
		Assertions.assertEquals(Boolean.TRUE, resultJSON.get("isTemporary"));
		Assertions.assertEquals(sessionId + "/provisional/0", resultJSON.get("chunkId"));
		Assertions.assertEquals(50, service.getSession(sessionId, ConfigServiceForTests.TEST_USER).getSession().getTotalSamples());
	}

	@Test
	public void testSessionFailures() {
		SessionResult duplicate = service.createSession(SimulatedBatches.newSession("service"));
		Assertions.assertEquals(ResultCode.SESSION_ALREADY_EXISTS, duplicate.getCode());

		SessionInfo shortId = SimulatedBatches.newSession("short");
		shortId.setSessionId("abc");
		Assertions.assertEquals(ResultCode.INVALID_REQUEST, service.createSession(shortId).getCode());

		Assertions.assertEquals(ResultCode.SESSION_NOT_FOUND, service.endSession(sessionId, "someotheruser").getCode());
		Assertions.assertEquals(ResultCode.SESSION_NOT_FOUND, service.deleteSession("ArchUnitTest_nosuchsession", ConfigServiceForTests.TEST_USER).getCode());
		Assertions.assertEquals(ResultCode.SESSION_NOT_FOUND, service.getProcessingStats(sessionId, "someotheruser").getCode());

		FinalizeResult noData = service.endSession(sessionId, ConfigServiceForTests.TEST_USER);
		Assertions.assertEquals(ResultCode.DATA_UNAVAILABLE, noData.getCode());
		Assertions.assertTrue(noData.isSuccess());

		SessionResult list = service.listSessions(ConfigServiceForTests.TEST_USER);
		Assertions.assertEquals(1, list.getSessions().size());
		Assertions.assertEquals(1, ((List<?>) list.toJSON().get("sessions")).size());
	}

	@Test
	public void testQueryFailures() {
		QueryResult foreign = service.query(new DataQuery(sessionId), "someotheruser");
		Assertions.assertEquals(ResultCode.SESSION_NOT_FOUND, foreign.getCode());
		Assertions.assertNull(foreign.toJSON().get("data"));

		QueryResult tooMany = service.query(new DataQuery(sessionId).withMaxPoints(1_000_000), ConfigServiceForTests.TEST_USER);
		Assertions.assertEquals(ResultCode.INVALID_REQUEST, tooMany.getCode());
	}

	/**
	 * A chunk store whose disk went away.
	 */
	private static class BrokenChunkStore extends InMemoryChunkStore {
		@Override
		public void insert(DataChunk chunk) throws IOException {
			throw new IOException("No space left on device");
		}
	}

	@Test
	public void testStorageErrors() throws Exception {
		configService = new ConfigServiceForTests(new InMemoryPersistence(), new BrokenChunkStore());
		service = new ArchiverService(configService);
		service.createSession(SimulatedBatches.newSession("broken"));
		String brokenSessionId = ConfigServiceForTests.ARCH_UNIT_TEST_SESSION_PREFIX + "broken";
		IngestResult result = service.ingestBatch(SimulatedBatches.batch(brokenSessionId, 0, 10), ConfigServiceForTests.TEST_USER);
		Assertions.assertEquals(ResultCode.STORAGE_ERROR, result.getCode());
		Assertions.assertEquals(0, configService.getSessionPersistence().getSession(brokenSessionId).getTotalSamples());
	}

	@Test
	public void testMissingArguments() {
		SessionResult noSession = service.createSession(null);
		Assertions.assertFalse(noSession.isSuccess());
		Assertions.assertEquals(ResultCode.INVALID_REQUEST, noSession.getCode());

		QueryResult noQuery = service.query(null, ConfigServiceForTests.TEST_USER);
		Assertions.assertFalse(noQuery.isSuccess());
		Assertions.assertEquals(ResultCode.INVALID_REQUEST, noQuery.getCode());

		IngestResult noBatch = service.ingestBatch((String) null, ConfigServiceForTests.TEST_USER);
		Assertions.assertFalse(noBatch.isSuccess());
		Assertions.assertEquals(ResultCode.INVALID_REQUEST, noBatch.getCode());
	}
}
