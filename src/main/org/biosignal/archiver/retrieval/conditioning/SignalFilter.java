package org.biosignal.archiver.retrieval.conditioning;

import java.util.EnumMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.biosignal.archiver.config.ConfigService;
import org.biosignal.archiver.config.DeviceType;

/**
 * Approximates a bandpass filter by cascading single pole recursive filters.
 * The signal goes through <code>order</code> high pass passes at the low cutoff and then <code>order</code> low pass passes at the high cutoff.
 * Each pass is causal and seeds its first output with its first input.
 * Inputs are never modified; every method returns a new array.
 * @author mshankar
 *
 */
public class SignalFilter {
	private static final Logger logger = LogManager.getLogger(SignalFilter.class.getName());
	public static final String FILTER_ORDER_PROPERTY = "org.biosignal.archiver.conditioning.filterOrder";
	public static final String BAND_PROPERTY_PREFIX = "org.biosignal.archiver.conditioning.band.";
	public static final int DEFAULT_ORDER = 4;

	private final int order;
	private final EnumMap<DeviceType, FilterBand> bands = new EnumMap<DeviceType, FilterBand>(DeviceType.class);

	/**
	 * Filter with the default order and the default band for each device type.
	 */
	public SignalFilter() {
		this.order = DEFAULT_ORDER;
		for(DeviceType deviceType : DeviceType.values()) {
			if(deviceType != DeviceType.UNKNOWN) {
				bands.put(deviceType, new FilterBand(deviceType.getDefaultLowCut(), deviceType.getDefaultHighCut()));
			}
		}
	}

	/**
	 * The order and the bands can be overridden using installation properties; for example, <code>org.biosignal.archiver.conditioning.band.IMU=0.5,20</code>.
	 * @param configService ConfigService
	 */
	public SignalFilter(ConfigService configService) {
		this.order = configService.getIntProperty(FILTER_ORDER_PROPERTY, DEFAULT_ORDER);
		for(DeviceType deviceType : DeviceType.values()) {
			if(deviceType == DeviceType.UNKNOWN) continue;
			String bandSpec = configService.getInstallationProperties().getProperty(BAND_PROPERTY_PREFIX + deviceType.name());
			if(bandSpec != null) {
				bands.put(deviceType, FilterBand.parse(bandSpec));
			} else {
				bands.put(deviceType, new FilterBand(deviceType.getDefaultLowCut(), deviceType.getDefaultHighCut()));
			}
		}
	}

	public int getOrder() {
		return order;
	}

	/**
	 * @param deviceType DeviceType
	 * @return The band for this device type; null for unknown devices.
	 */
	public FilterBand getBand(DeviceType deviceType) {
		return deviceType == null ? null : bands.get(deviceType);
	}

	/**
	 * Bandpass filter the data.
	 * If the band is not valid for this sample rate, we log a warning and return the data unfiltered.
	 * @param data Signal
	 * @param sampleRate Sampling rate in Hz
	 * @param lowCut Low cutoff in Hz
	 * @param highCut High cutoff in Hz
	 * @param order Number of passes of each stage
	 * @return Filtered signal
	 */
	public double[] bandpass(double[] data, double sampleRate, double lowCut, double highCut, int order) {
		if(data == null || data.length == 0) return new double[0];
		double nyquist = sampleRate / 2;
		if(lowCut <= 0 || highCut >= nyquist || lowCut >= highCut) {
			logger.warn("Invalid filter frequencies lowCut=" + lowCut + ", highCut=" + highCut + ", nyquist=" + nyquist + "; returning unfiltered data");
			return data.clone();
		}
		double[] filtered = highpass(data, sampleRate, lowCut, order);
		return lowpass(filtered, sampleRate, highCut, order);
	}

	public double[] bandpass(double[] data, double sampleRate, FilterBand band) {
		return bandpass(data, sampleRate, band.getLowCut(), band.getHighCut(), order);
	}

	public double[] highpass(double[] data, double sampleRate, double cutoff, int order) {
		double rc = 1.0 / (2.0 * Math.PI * cutoff);
		double dt = 1.0 / sampleRate;
		double alpha = rc / (rc + dt);
		double[] result = data;
		for(int pass = 0; pass < order; pass++) {
			double[] filtered = new double[result.length];
			filtered[0] = result[0];
			for(int n = 1; n < result.length; n++) {
				filtered[n] = alpha * (filtered[n - 1] + result[n] - result[n - 1]);
			}
			result = filtered;
		}
		return result == data ? data.clone() : result;
	}

	public double[] lowpass(double[] data, double sampleRate, double cutoff, int order) {
		double rc = 1.0 / (2.0 * Math.PI * cutoff);
		double dt = 1.0 / sampleRate;
		double alpha = dt / (rc + dt);
		double[] result = data;
		for(int pass = 0; pass < order; pass++) {
			double[] filtered = new double[result.length];
			filtered[0] = result[0];
			for(int n = 1; n < result.length; n++) {
				filtered[n] = filtered[n - 1] + alpha * (result[n] - filtered[n - 1]);
			}
			result = filtered;
		}
		return result == data ? data.clone() : result;
	}

	/**
	 * Apply the band for this device type.
	 * Unknown device types get the data back unfiltered.
	 * @param data Signal
	 * @param deviceType DeviceType
	 * @param sampleRate Sampling rate in Hz
	 * @return Filtered signal
	 */
	public double[] filterByDeviceType(double[] data, DeviceType deviceType, double sampleRate) {
		FilterBand band = getBand(deviceType);
		if(band == null) {
			logger.warn("Unknown device type " + deviceType + "; returning unfiltered data");
			return data == null ? new double[0] : data.clone();
		}
		return bandpass(data, sampleRate, band);
	}

	/**
	 * Forward backward filtering; filter, reverse, filter again and reverse back.
	 * This removes the phase distortion but needs the entire signal in memory.
	 * @param data Signal
	 * @param deviceType DeviceType
	 * @param sampleRate Sampling rate in Hz
	 * @return Filtered signal
	 */
	public double[] zeroPhase(double[] data, DeviceType deviceType, double sampleRate) {
		double[] filtered = filterByDeviceType(data, deviceType, sampleRate);
		reverse(filtered);
		filtered = filterByDeviceType(filtered, deviceType, sampleRate);
		reverse(filtered);
		return filtered;
	}

	/**
	 * Approximate magnitude response of the device's band; 1 in the band, rolling off as a power of the order outside it.
	 * @param deviceType DeviceType
	 * @param sampleRate Sampling rate in Hz
	 * @return FrequencyResponse; null for unknown devices.
	 */
	public FrequencyResponse getFrequencyResponse(DeviceType deviceType, double sampleRate) {
		FilterBand band = getBand(deviceType);
		if(band == null) return null;
		double nyquist = sampleRate / 2;
		int points = 0;
		for(double f = 0.1; f < nyquist; f *= 1.1) {
			points++;
		}
		double[] frequencies = new double[points];
		double[] response = new double[points];
		int i = 0;
		for(double f = 0.1; f < nyquist; f *= 1.1) {
			double h = 1.0;
			if(f < band.getLowCut()) {
				h *= Math.pow(f / band.getLowCut(), order);
			}
			if(f > band.getHighCut()) {
				h *= Math.pow(band.getHighCut() / f, order);
			}
			frequencies[i] = f;
			response[i] = h;
			i++;
		}
		return new FrequencyResponse(frequencies, response, band, sampleRate);
	}

	private static void reverse(double[] data) {
		for(int i = 0, j = data.length - 1; i < j; i++, j--) {
			double tmp = data[i];
			data[i] = data[j];
			data[j] = tmp;
		}
	}
}
