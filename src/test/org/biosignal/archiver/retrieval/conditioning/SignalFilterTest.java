package org.biosignal.archiver.retrieval.conditioning;

import java.util.Arrays;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.biosignal.archiver.config.ConfigServiceForTests;
import org.biosignal.archiver.config.DeviceType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Test the cascaded single pole filters.
 * @author mshankar
 *
 */
public class SignalFilterTest {
	private static final Logger logger = LogManager.getLogger(SignalFilterTest.class.getName());

	private static double[] constant(int size, double value) {
		double[] ret = new double[size];
		Arrays.fill(ret, value);
		return ret;
	}

	private static double[] sine(int size, double frequency, double sampleRate) {
		double[] ret = new double[size];
		for(int i = 0; i < size; i++) {
			ret[i] = Math.sin(2 * Math.PI * frequency * i / sampleRate);
		}
		return ret;
	}

	@Test
	public void testInvalidBandReturnsInput() {
		SignalFilter filter = new SignalFilter();
		double[] data = sine(100, 5, 100);
		// High cut at or above nyquist
		Assertions.assertArrayEquals(data, filter.bandpass(data, 100, 20, 50, 4));
		// Low cut above high cut
		Assertions.assertArrayEquals(data, filter.bandpass(data, 1000, 300, 200, 4));
		Assertions.assertArrayEquals(data, filter.bandpass(data, 1000, 0, 200, 4));
		Assertions.assertNotSame(data, filter.bandpass(data, 100, 20, 50, 4));
	}

	@Test
	public void testInputIsNotModified() {
		SignalFilter filter = new SignalFilter();
		double[] data = sine(1000, 50, 1000);
		double[] copy = data.clone();
		filter.filterByDeviceType(data, DeviceType.SEMG, 1000);
		filter.zeroPhase(data, DeviceType.SEMG, 1000);
		filter.highpass(data, 1000, 20, 4);
		filter.lowpass(data, 1000, 400, 4);
		Assertions.assertArrayEquals(copy, data);
	}

	@Test
	public void testHighpassRemovesDC() {
		SignalFilter filter = new SignalFilter();
		double[] filtered = filter.filterByDeviceType(constant(1000, 5.0), DeviceType.SEMG, 1000);
		Assertions.assertEquals(1000, filtered.length);
		logger.info("Last value after filtering a constant " + filtered[999]);
		Assertions.assertEquals(0.0, filtered[999], 1e-6);
	}

	@Test
	public void testLowpassKeepsDC() {
		SignalFilter filter = new SignalFilter();
		double[] filtered = filter.lowpass(constant(200, 3.0), 1000, 20, 4);
		for(double value : filtered) {
			Assertions.assertEquals(3.0, value, 1e-12);
		}
	}

	@Test
	public void testPassbandVersusStopband() {
		SignalFilter filter = new SignalFilter();
		int size = 4000;
		double[] inBand = filter.filterByDeviceType(sine(size, 5, 1000), DeviceType.IMU, 1000);
		double[] outOfBand = filter.filterByDeviceType(sine(size, 200, 1000), DeviceType.IMU, 1000);
		double inBandPeak = Arrays.stream(inBand, size / 2, size).map(Math::abs).max().getAsDouble();
		double outOfBandPeak = Arrays.stream(outOfBand, size / 2, size).map(Math::abs).max().getAsDouble();
		logger.info("In band peak " + inBandPeak + " out of band peak " + outOfBandPeak);
		Assertions.assertTrue(inBandPeak > 10 * outOfBandPeak);
	}

	@Test
	public void testUnknownDevice() {
		SignalFilter filter = new SignalFilter();
		double[] data = sine(100, 5, 1000);
		Assertions.assertArrayEquals(data, filter.filterByDeviceType(data, DeviceType.UNKNOWN, 1000));
		Assertions.assertArrayEquals(data, filter.filterByDeviceType(data, null, 1000));
		Assertions.assertNull(filter.getFrequencyResponse(DeviceType.UNKNOWN, 1000));
	}

	@Test
	public void testZeroPhasePreservesLength() {
		SignalFilter filter = new SignalFilter();
		Assertions.assertEquals(777, filter.zeroPhase(sine(777, 5, 100), DeviceType.IMU, 100).length);
		Assertions.assertEquals(0, filter.zeroPhase(new double[0], DeviceType.IMU, 100).length);
	}

	@Test
	public void testFrequencyResponse() {
		FrequencyResponse response = new SignalFilter().getFrequencyResponse(DeviceType.IMU, 1000);
		double[] frequencies = response.getFrequencies();
		Assertions.assertEquals(frequencies.length, response.getResponse().length);
		Assertions.assertEquals(0.1, frequencies[0], 1e-12);
		Assertions.assertEquals(Math.pow(0.1 / 0.5, 4), response.getResponse()[0], 1e-12);
		for(int i = 0; i < frequencies.length; i++) {
			Assertions.assertTrue(frequencies[i] < 500);
			if(frequencies[i] >= 0.5 && frequencies[i] <= 20) {
				Assertions.assertEquals(1.0, response.getResponse()[i]);
			}
		}
		Assertions.assertEquals(20.0, response.toJSON().get("highCut"));
	}

	@Test
	public void testBandsFromProperties() {
		ConfigServiceForTests configService = new ConfigServiceForTests()
				.withProperty(SignalFilter.BAND_PROPERTY_PREFIX + "IMU", "1,10")
				.withProperty(SignalFilter.FILTER_ORDER_PROPERTY, "2");
		SignalFilter filter = new SignalFilter(configService);
		Assertions.assertEquals(2, filter.getOrder());
		Assertions.assertEquals(1.0, filter.getBand(DeviceType.IMU).getLowCut());
		Assertions.assertEquals(10.0, filter.getBand(DeviceType.IMU).getHighCut());
		Assertions.assertEquals(400.0, filter.getBand(DeviceType.SEMG).getHighCut());
		Assertions.assertNull(filter.getBand(DeviceType.UNKNOWN));
		Assertions.assertTrue(filter.getBand(DeviceType.SEMG).isValidFor(1000));
		Assertions.assertFalse(filter.getBand(DeviceType.SEMG).isValidFor(500));
	}
}
