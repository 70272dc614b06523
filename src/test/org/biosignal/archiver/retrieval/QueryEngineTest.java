package org.biosignal.archiver.retrieval;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.biosignal.archiver.config.ConfigServiceForTests;
import org.biosignal.archiver.config.DeviceType;
import org.biosignal.archiver.config.SessionInfo;
import org.biosignal.archiver.data.ChannelStats;
import org.biosignal.archiver.data.DataChunk;
import org.biosignal.archiver.data.Sample;
import org.biosignal.archiver.engine.BatchIngestor;
import org.biosignal.archiver.engine.DeviceInfo;
import org.biosignal.archiver.engine.UploadBatch;
import org.biosignal.archiver.retrieval.conditioning.ConditioningRequest;
import org.biosignal.archiver.retrieval.conditioning.SeriesStats;
import org.biosignal.archiver.retrieval.conditioning.SignalFilter;
import org.biosignal.archiver.utils.simulation.SimulatedBatches;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Retrieval over three provisional chunks with gaps between them.
 * The chunks cover offsets 0-99, 300-399 and 600-699 from BASE_TIME.
 * @author mshankar
 *
 */
public class QueryEngineTest {
	private static final Logger logger = LogManager.getLogger(QueryEngineTest.class.getName());
	private static final long[] CHUNK_OFFSETS = new long[] {0, 300, 600};
	private ConfigServiceForTests configService;
	private String sessionId;

	@BeforeEach
	public void setUp() throws Exception {
		configService = new ConfigServiceForTests();
		SessionInfo session = SimulatedBatches.newSession("query");
		sessionId = session.getSessionId();
		configService.getSessionPersistence().addSession(session);
		BatchIngestor ingestor = new BatchIngestor(configService);
		for(long offset : CHUNK_OFFSETS) {
			ingestor.ingest(SimulatedBatches.batch(sessionId, offset, 100), ConfigServiceForTests.TEST_USER);
		}
	}

	@Test
	public void testAllData() throws Exception {
		QueryResult result = new QueryEngine(configService).query(new DataQuery(sessionId));
		Assertions.assertTrue(result.isSuccess());
		Assertions.assertEquals(3, result.getChunks());
		Assertions.assertEquals(300, result.getTotalSamples());
		Assertions.assertEquals(1, result.getDecimationStride());
		Assertions.assertEquals(DataChunk.CHANNEL_COUNT, result.getChannels().size());
		Assertions.assertEquals(Long.valueOf(SimulatedBatches.BASE_TIME), result.getFirstChunkStart());
		Assertions.assertEquals(Long.valueOf(SimulatedBatches.BASE_TIME + 699), result.getLastChunkEnd());
		ChannelSeries series = result.getChannel(4);
		Assertions.assertEquals(300, series.size());
		for(int i = 0; i < series.size(); i++) {
			Assertions.assertEquals(SimulatedBatches.valueFor(4, series.getTimestamp(i)), series.getValue(i));
		}
	}

	@Test
	public void testTimeRangeSelectsOneChunk() throws Exception {
		QueryResult result = new QueryEngine(configService).query(new DataQuery(sessionId)
				.withTimeRange(SimulatedBatches.BASE_TIME + 300, SimulatedBatches.BASE_TIME + 399));
		Assertions.assertEquals(1, result.getChunks());
		Assertions.assertEquals(100, result.getTotalSamples());
		DataChunk middle = configService.getChunkStore().scanProvisional(sessionId).get(1);
		for(int channel = 0; channel < DataChunk.CHANNEL_COUNT; channel++) {
			ChannelStats expected = middle.getStats(channel);
			AggregatedChannelStats actual = result.getStats(channel);
			Assertions.assertEquals(expected.getMin(), actual.getMin());
			Assertions.assertEquals(expected.getMax(), actual.getMax());
			Assertions.assertEquals(expected.getAvg(), actual.getAvg());
			Assertions.assertEquals(expected.getRms(), actual.getRms(), 1e-12);
			Assertions.assertEquals(100, actual.getCount());
		}
	}

	@Test
	public void testAggregatedStatsMatchDirectComputation() throws Exception {
		QueryResult result = new QueryEngine(configService).query(new DataQuery(sessionId).withChannels(new int[] {2, 7}));
		for(int channel : new int[] {2, 7}) {
			SummaryStatistics direct = new SummaryStatistics();
			for(long offset : CHUNK_OFFSETS) {
				for(int i = 0; i < 100; i++) {
					direct.addValue(SimulatedBatches.valueFor(channel, SimulatedBatches.BASE_TIME + offset + i));
				}
			}
			AggregatedChannelStats stats = result.getStats(channel);
			logger.info("Channel " + channel + " aggregated " + stats + " direct mean " + direct.getMean());
			Assertions.assertEquals(direct.getMin(), stats.getMin(), 1e-9);
			Assertions.assertEquals(direct.getMax(), stats.getMax(), 1e-9);
			// Chunk stats are stored to 4 decimals
			Assertions.assertEquals(direct.getMean(), stats.getAvg(), 1e-4);
			Assertions.assertEquals(Math.sqrt(direct.getSumsq() / direct.getN()), stats.getRms(), 1e-4);
			Assertions.assertEquals(300, stats.getCount());
		}
	}

	@Test
	public void testChannelProjectionKeepsRequestOrder() throws Exception {
		QueryResult result = new QueryEngine(configService).query(new DataQuery(sessionId).withChannels("7,2"));
		List<Integer> channels = new ArrayList<Integer>(result.getChannels().keySet());
		Assertions.assertEquals(List.of(7, 2), channels);
		Assertions.assertEquals(List.of(7, 2), new ArrayList<Integer>(result.getStats().keySet()));
	}

	@Test
	public void testDecimationIsASubsequence() throws Exception {
		QueryEngine engine = new QueryEngine(configService);
		ChannelSeries full = engine.query(new DataQuery(sessionId).withChannels("1")).getChannel(1);
		for(int maxPoints : new int[] {1, 7, 100, 299, 300}) {
			QueryResult result = engine.query(new DataQuery(sessionId).withChannels("1").withMaxPoints(maxPoints));
			ChannelSeries decimated = result.getChannel(1);
			int stride = result.getDecimationStride();
			Assertions.assertTrue(decimated.size() <= maxPoints, "Got " + decimated.size() + " points for a budget of " + maxPoints);
			for(int j = 0; j < decimated.size(); j++) {
				Assertions.assertEquals(full.getTimestamp(j * stride), decimated.getTimestamp(j));
				Assertions.assertEquals(full.getValue(j * stride), decimated.getValue(j));
			}
			// Stats are for everything retrieved, not just the points returned
			Assertions.assertEquals(300, result.getStats(1).getCount());
		}
	}

	@Test
	public void testMaxPointsBounds() {
		QueryEngine engine = new QueryEngine(configService);
		Assertions.assertThrows(IllegalArgumentException.class, () -> engine.query(new DataQuery(sessionId).withMaxPoints(0)));
		Assertions.assertThrows(IllegalArgumentException.class, () -> engine.query(new DataQuery(sessionId).withMaxPoints(100001)));
	}

	@Test
	public void testEmptyRange() throws Exception {
		QueryResult result = new QueryEngine(configService).query(new DataQuery(sessionId)
				.withTimeRange(SimulatedBatches.BASE_TIME + 150, SimulatedBatches.BASE_TIME + 250).withChannels("0"));
		Assertions.assertEquals(0, result.getChunks());
		Assertions.assertEquals(0, result.getTotalSamples());
		Assertions.assertEquals(0, result.getChannel(0).size());
		Assertions.assertEquals(0, result.getStats(0).getCount());
		Assertions.assertEquals(0.0, result.getStats(0).getMin());
		Assertions.assertNull(result.getFirstChunkStart());
	}

	@Test
	public void testNormalizedQuery() throws Exception {
		QueryResult result = new QueryEngine(configService).query(new DataQuery(sessionId).withChannels("3")
				.withConditioning(ConditioningRequest.normalizeOnly("min_max")));
		SeriesStats normalized = result.getNormalizedStats().get(3);
		Assertions.assertEquals(0.0, normalized.getMin(), 1e-12);
		Assertions.assertEquals(1.0, normalized.getMax(), 1e-12);
		Assertions.assertEquals(300, normalized.getCount());
		// The stored stats are still for the raw values
		Assertions.assertEquals(300.0, result.getStats(3).getMin());
		ChannelSeries series = result.getChannel(3);
		Assertions.assertEquals(SimulatedBatches.BASE_TIME, series.getTimestamp(0));
		Assertions.assertEquals(0.0, series.getValue(0), 1e-12);
	}

	@Test
	public void testJSON() throws Exception {
		QueryResult result = new QueryEngine(configService).query(new DataQuery(sessionId).withChannels("0").withMaxPoints(10));
		JSONObject json = result.toJSON();
		logger.info(json.toJSONString());
		Assertions.assertEquals(Boolean.TRUE, json.get("success"));
		JSONObject data = (JSONObject) json.get("data");
		Assertions.assertEquals(sessionId, data.get("sessionId"));
		Assertions.assertEquals(300L, ((Number) data.get("totalSamples")).longValue());
		JSONArray ch0 = (JSONArray) ((JSONObject) data.get("channels")).get("ch0");
		Assertions.assertEquals(10, ch0.size());
		JSONObject point = (JSONObject) ch0.get(0);
		Assertions.assertEquals(SimulatedBatches.BASE_TIME, ((Number) point.get("timestamp")).longValue());
		Assertions.assertNotNull(((JSONObject) data.get("stats")).get("ch0"));
		Assertions.assertNull(data.get("normalizedStats"));
	}

	@Test
	public void testTimeRangeWithOutOfOrderChunks() throws Exception {
		SessionInfo session = SimulatedBatches.newSession("queryOutOfOrder");
		configService.getSessionPersistence().addSession(session);
		BatchIngestor ingestor = new BatchIngestor(configService);
		ingestor.ingest(SimulatedBatches.batch(session.getSessionId(), 500, 100), ConfigServiceForTests.TEST_USER);
		ingestor.ingest(SimulatedBatches.batch(session.getSessionId(), 0, 100), ConfigServiceForTests.TEST_USER);
		QueryResult result = new QueryEngine(configService).query(new DataQuery(session.getSessionId()).withChannels("0"));
		Assertions.assertEquals(2, result.getChunks());
		Assertions.assertEquals(Long.valueOf(SimulatedBatches.BASE_TIME), result.getFirstChunkStart());
		Assertions.assertEquals(Long.valueOf(SimulatedBatches.BASE_TIME + 599), result.getLastChunkEnd());
	}

	/**
	 * A 5Hz sine sampled at 1000Hz is inside the IMU band.
	 * Filtering has to happen at the recorded sample rate, before the series is thinned out for display.
	 */
	@Test
	public void testFilteringBeforeDecimation() throws Exception {
		int sampleRate = 1000;
		int count = 4000;
		SessionInfo session = SimulatedBatches.newSession("sine");
		String sineSession = session.getSessionId();
		configService.getSessionPersistence().addSession(session);
		List<Sample> samples = new ArrayList<Sample>(count);
		double[] raw = new double[count];
		for(int i = 0; i < count; i++) {
			raw[i] = Math.sin(2 * Math.PI * 5 * i / sampleRate);
			double[] values = new double[DataChunk.CHANNEL_COUNT];
			values[0] = raw[i];
			samples.add(new Sample(SimulatedBatches.BASE_TIME + i, values, sineSession));
		}
		new BatchIngestor(configService).ingest(new UploadBatch(sineSession, samples, new DeviceInfo("IMU-1", "00:11:22:33:44:55")), ConfigServiceForTests.TEST_USER);

		QueryResult result = new QueryEngine(configService).query(new DataQuery(sineSession).withChannels("0").withMaxPoints(200)
				.withConditioning(new ConditioningRequest(null, DeviceType.IMU, sampleRate, true)));
		int stride = result.getDecimationStride();
		Assertions.assertEquals(20, stride);
		ChannelSeries conditioned = result.getChannel(0);
		Assertions.assertEquals(200, conditioned.size());

		double[] expected = new SignalFilter(configService).zeroPhase(raw, DeviceType.IMU, sampleRate);
		double expectedPeak = 0;
		for(double value : expected) expectedPeak = Math.max(expectedPeak, Math.abs(value));
		double peak = 0;
		for(int j = 0; j < conditioned.size(); j++) {
			Assertions.assertEquals(SimulatedBatches.BASE_TIME + (long) j * stride, conditioned.getTimestamp(j));
			Assertions.assertEquals(expected[j * stride], conditioned.getValue(j), 1e-9);
			peak = Math.max(peak, Math.abs(conditioned.getValue(j)));
		}
		logger.info("Peak of the filtered sine " + expectedPeak + " and of the decimated output " + peak);
		Assertions.assertTrue(expectedPeak > 0.5, "In band signal should pass the filter; peak " + expectedPeak);
		Assertions.assertTrue(peak > 0.9 * expectedPeak, "Decimated peak " + peak + " filtered peak " + expectedPeak);
		// Stats of the conditioned series cover every retrieved sample
		Assertions.assertEquals(count, result.getNormalizedStats().get(0).getCount());
	}
}
