package org.biosignal.archiver.retrieval.conditioning;

import org.biosignal.archiver.config.DeviceType;

/**
 * What conditioning to apply to the channels of a query result.
 * A null normalizer means filter only; a null device type means normalize only.
 */
public class ConditioningRequest {
	private String normalizer;
	private DeviceType deviceType;
	private double sampleRate;
	private boolean zeroPhase = false;

	public ConditioningRequest() {
	}

	public ConditioningRequest(String normalizer, DeviceType deviceType, double sampleRate, boolean zeroPhase) {
		this.normalizer = normalizer;
		this.deviceType = deviceType;
		this.sampleRate = sampleRate;
		this.zeroPhase = zeroPhase;
	}

	public static ConditioningRequest normalizeOnly(String normalizer) {
		return new ConditioningRequest(normalizer, null, 0, false);
	}

	public boolean isFilteringRequested() {
		return deviceType != null && sampleRate > 0;
	}

	public String getNormalizer() {
		return normalizer;
	}

	public void setNormalizer(String normalizer) {
		this.normalizer = normalizer;
	}

	public DeviceType getDeviceType() {
		return deviceType;
	}

	public void setDeviceType(DeviceType deviceType) {
		this.deviceType = deviceType;
	}

	public double getSampleRate() {
		return sampleRate;
	}

	public void setSampleRate(double sampleRate) {
		this.sampleRate = sampleRate;
	}

	public boolean isZeroPhase() {
		return zeroPhase;
	}

	public void setZeroPhase(boolean zeroPhase) {
		this.zeroPhase = zeroPhase;
	}

	@Override
	public String toString() {
		return "normalizer=" + normalizer + " deviceType=" + deviceType + " sampleRate=" + sampleRate + " zeroPhase=" + zeroPhase;
	}
}
