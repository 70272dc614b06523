package org.biosignal.archiver.engine;

import java.util.List;

import org.biosignal.archiver.data.Sample;

/**
 * One upload from a device; samples are in sample major layout.
 * @author mshankar
 *
 */
public class UploadBatch {
	private final String sessionId;
	private final List<Sample> samples;
	private final DeviceInfo deviceInfo;
	private final BatchInfo batchInfo;

	public UploadBatch(String sessionId, List<Sample> samples, DeviceInfo deviceInfo, BatchInfo batchInfo) {
		this.sessionId = sessionId;
		this.samples = samples;
		this.deviceInfo = deviceInfo;
		this.batchInfo = batchInfo;
	}

	/**
	 * Convenience constructor that fills in the batch info from the samples themselves.
	 * @param sessionId Session
	 * @param samples Samples in the order the device sent them
	 * @param deviceInfo DeviceInfo; may be null
	 */
	public UploadBatch(String sessionId, List<Sample> samples, DeviceInfo deviceInfo) {
		this(sessionId, samples, deviceInfo, samples.isEmpty() ? new BatchInfo(0, 0, 0)
				: new BatchInfo(samples.size(), samples.get(0).getTimestamp(), samples.get(samples.size() - 1).getTimestamp()));
	}

	public String getSessionId() {
		return sessionId;
	}

	public List<Sample> getSamples() {
		return samples;
	}

	public DeviceInfo getDeviceInfo() {
		return deviceInfo;
	}

	public BatchInfo getBatchInfo() {
		return batchInfo;
	}

	@Override
	public String toString() {
		return "UploadBatch for " + sessionId + " with " + (samples == null ? 0 : samples.size()) + " samples";
	}
}
