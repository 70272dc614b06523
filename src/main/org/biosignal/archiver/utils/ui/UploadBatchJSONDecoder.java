package org.biosignal.archiver.utils.ui;

import java.util.ArrayList;
import java.util.List;

import org.biosignal.archiver.data.Sample;
import org.biosignal.archiver.engine.BatchInfo;
import org.biosignal.archiver.engine.DeviceInfo;
import org.biosignal.archiver.engine.UploadBatch;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * Decodes the JSON that devices upload into an {@link UploadBatch}.
 * <pre>
 * { "sessionId": "...", "samples": [ { "timestamp": 1700000000000, "values": [ ... ], "sessionId": "..." } ],
 *   "deviceInfo": { "name": "...", "address": "..." }, "batchInfo": { "size": 500, "startTime": ..., "endTime": ... } }
 * </pre>
 * Structural problems (missing fields, wrong types) are reported as IllegalArgumentException; consistency checks are left to the BatchValidator.
 * Timestamps are whole epoch milliseconds; fractional values are rejected rather than truncated.
 * @author mshankar
 *
 */
public class UploadBatchJSONDecoder {

	public static UploadBatch decode(String jsonStr) {
		if(jsonStr == null) {
			throw new IllegalArgumentException("Upload batch is empty");
		}
		try {
			Object parsed = new JSONParser().parse(jsonStr);
			if(!(parsed instanceof JSONObject)) {
				throw new IllegalArgumentException("Expecting a JSON object for an upload batch");
			}
			return decode((JSONObject) parsed);
		} catch(ParseException ex) {
			throw new IllegalArgumentException("Cannot parse upload batch " + ex.toString(), ex);
		}
	}

	public static UploadBatch decode(JSONObject jsonObj) {
		if(jsonObj == null) {
			throw new IllegalArgumentException("Upload batch is empty");
		}
		String sessionId = getString(jsonObj, "sessionId", true);
		Object samplesObj = jsonObj.get("samples");
		if(!(samplesObj instanceof JSONArray)) {
			throw new IllegalArgumentException("Samples must be an array");
		}
		JSONArray samplesArray = (JSONArray) samplesObj;
		List<Sample> samples = new ArrayList<Sample>(samplesArray.size());
		for(Object sampleObj : samplesArray) {
			if(!(sampleObj instanceof JSONObject)) {
				throw new IllegalArgumentException("Each sample must be an object");
			}
			samples.add(decodeSample((JSONObject) sampleObj));
		}

		DeviceInfo deviceInfo = null;
		Object deviceInfoObj = jsonObj.get("deviceInfo");
		if(deviceInfoObj instanceof JSONObject) {
			deviceInfo = new DeviceInfo(getString((JSONObject) deviceInfoObj, "name", false), getString((JSONObject) deviceInfoObj, "address", false));
		}

		Object batchInfoObj = jsonObj.get("batchInfo");
		if(!(batchInfoObj instanceof JSONObject)) {
			throw new IllegalArgumentException("Batch info is required");
		}
		JSONObject batchInfoJSON = (JSONObject) batchInfoObj;
		BatchInfo batchInfo = new BatchInfo(
				(int) getNumber(batchInfoJSON, "size").longValue(),
				getEpochMillis(batchInfoJSON, "startTime"),
				getEpochMillis(batchInfoJSON, "endTime"));
		return new UploadBatch(sessionId, samples, deviceInfo, batchInfo);
	}

	private static Sample decodeSample(JSONObject sampleObj) {
		long timestamp = getEpochMillis(sampleObj, "timestamp");
		Object valuesObj = sampleObj.get("values");
		if(!(valuesObj instanceof JSONArray)) {
			throw new IllegalArgumentException("Sample values must be an array");
		}
		JSONArray valuesArray = (JSONArray) valuesObj;
		double[] values = new double[valuesArray.size()];
		for(int i = 0; i < values.length; i++) {
			Object value = valuesArray.get(i);
			if(!(value instanceof Number)) {
				throw new IllegalArgumentException("Sample value " + value + " is not a number");
			}
			values[i] = ((Number) value).doubleValue();
		}
		return new Sample(timestamp, values, getString(sampleObj, "sessionId", false));
	}

	private static String getString(JSONObject obj, String key, boolean required) {
		Object val = obj.get(key);
		if(val == null) {
			if(required) throw new IllegalArgumentException(key + " is required");
			return null;
		}
		return val.toString();
	}

	private static Number getNumber(JSONObject obj, String key) {
		Object val = obj.get(key);
		if(!(val instanceof Number)) {
			throw new IllegalArgumentException(key + " must be a number; got " + val);
		}
		return (Number) val;
	}

	private static long getEpochMillis(JSONObject obj, String key) {
		Number val = getNumber(obj, key);
		if(val instanceof Long || val instanceof Integer) {
			return val.longValue();
		}
		double millis = val.doubleValue();
		if(Double.isNaN(millis) || Double.isInfinite(millis) || millis != Math.rint(millis)) {
			throw new IllegalArgumentException(key + " must be in whole epoch milliseconds; got " + val);
		}
		return (long) millis;
	}
}
