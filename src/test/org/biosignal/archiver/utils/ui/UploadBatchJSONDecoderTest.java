package org.biosignal.archiver.utils.ui;

import org.biosignal.archiver.engine.UploadBatch;
import org.biosignal.archiver.utils.simulation.SimulatedBatches;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Decoding the batches that devices upload.
 * @author mshankar
 *
 */
public class UploadBatchJSONDecoderTest {
	private static final String SESSION = "ArchUnitTest_decoder";

	@Test
	public void testDecode() {
		UploadBatch original = SimulatedBatches.batch(SESSION, 0, 20);
		UploadBatch decoded = UploadBatchJSONDecoder.decode(SimulatedBatches.toUploadJSON(original).toJSONString());
		Assertions.assertEquals(SESSION, decoded.getSessionId());
		Assertions.assertEquals(20, decoded.getSamples().size());
		Assertions.assertEquals(20, decoded.getBatchInfo().getSize());
		Assertions.assertEquals(SimulatedBatches.BASE_TIME, decoded.getBatchInfo().getStartTime());
		Assertions.assertEquals(SimulatedBatches.BASE_TIME + 19, decoded.getBatchInfo().getEndTime());
		Assertions.assertEquals("HC-05", decoded.getDeviceInfo().getName());
		for(int i = 0; i < 20; i++) {
			Assertions.assertEquals(original.getSamples().get(i).getTimestamp(), decoded.getSamples().get(i).getTimestamp());
			Assertions.assertArrayEquals(original.getSamples().get(i).getValues(), decoded.getSamples().get(i).getValues());
			Assertions.assertEquals(SESSION, decoded.getSamples().get(i).getSessionId());
		}
	}

	@Test
	public void testIntegerValues() {
		String json = "{\"sessionId\":\"" + SESSION + "\",\"samples\":[{\"timestamp\":1700000000000,\"values\":[1,2,3.5]}],"
				+ "\"batchInfo\":{\"size\":1,\"startTime\":1700000000000,\"endTime\":1700000000000}}";
		UploadBatch decoded = UploadBatchJSONDecoder.decode(json);
		Assertions.assertArrayEquals(new double[] {1.0, 2.0, 3.5}, decoded.getSamples().get(0).getValues());
		Assertions.assertNull(decoded.getSamples().get(0).getSessionId());
		Assertions.assertNull(decoded.getDeviceInfo());
	}

	@SuppressWarnings("unchecked")
	@Test
	public void testStructuralProblems() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> UploadBatchJSONDecoder.decode("{not json"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> UploadBatchJSONDecoder.decode("[1, 2]"));

		JSONObject noSession = SimulatedBatches.toUploadJSON(SimulatedBatches.batch(SESSION, 0, 2));
		noSession.remove("sessionId");
		Assertions.assertThrows(IllegalArgumentException.class, () -> UploadBatchJSONDecoder.decode(noSession));

		JSONObject noBatchInfo = SimulatedBatches.toUploadJSON(SimulatedBatches.batch(SESSION, 0, 2));
		noBatchInfo.remove("batchInfo");
		Assertions.assertThrows(IllegalArgumentException.class, () -> UploadBatchJSONDecoder.decode(noBatchInfo));

		JSONObject badValue = SimulatedBatches.toUploadJSON(SimulatedBatches.batch(SESSION, 0, 2));
		JSONObject firstSample = (JSONObject) ((JSONArray) badValue.get("samples")).get(0);
		((JSONArray) firstSample.get("values")).add("abc");
		Assertions.assertThrows(IllegalArgumentException.class, () -> UploadBatchJSONDecoder.decode(badValue));

		JSONObject badTimestamp = SimulatedBatches.toUploadJSON(SimulatedBatches.batch(SESSION, 0, 2));
		((JSONObject) ((JSONArray) badTimestamp.get("samples")).get(1)).put("timestamp", "yesterday");
		Assertions.assertThrows(IllegalArgumentException.class, () -> UploadBatchJSONDecoder.decode(badTimestamp));
	}

	@Test
	public void testFractionalTimestampsAreRejected() {
		String fractional = "{\"sessionId\":\"" + SESSION + "\",\"samples\":["
				+ "{\"timestamp\":1700000000000.1,\"values\":[1]},{\"timestamp\":1700000000000.6,\"values\":[2]}],"
				+ "\"batchInfo\":{\"size\":2,\"startTime\":1700000000000,\"endTime\":1700000000001}}";
		IllegalArgumentException ex = Assertions.assertThrows(IllegalArgumentException.class, () -> UploadBatchJSONDecoder.decode(fractional));
		Assertions.assertTrue(ex.getMessage().contains("timestamp"), ex.getMessage());

		String fractionalEnd = "{\"sessionId\":\"" + SESSION + "\",\"samples\":[{\"timestamp\":1700000000000,\"values\":[1]}],"
				+ "\"batchInfo\":{\"size\":1,\"startTime\":1700000000000,\"endTime\":1700000000000.5}}";
		Assertions.assertThrows(IllegalArgumentException.class, () -> UploadBatchJSONDecoder.decode(fractionalEnd));

		// A whole number written with a decimal point is fine
		String wholeAsDouble = "{\"sessionId\":\"" + SESSION + "\",\"samples\":[{\"timestamp\":1700000000002.0,\"values\":[1]}],"
				+ "\"batchInfo\":{\"size\":1,\"startTime\":1700000000002,\"endTime\":1700000000002}}";
		Assertions.assertEquals(1700000000002L, UploadBatchJSONDecoder.decode(wholeAsDouble).getSamples().get(0).getTimestamp());
	}
}
