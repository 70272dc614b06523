package org.biosignal.archiver.retrieval.conditioning;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Test the normalizers and how we look them up.
 * @author mshankar
 *
 */
public class NormalizersTest {

	@Test
	public void testMinMax() {
		Normalizer normalizer = Normalizers.findNormalizer("min_max");
		Assertions.assertEquals(MinMaxNormalizer.IDENTITY, normalizer.getIdentity());
		Assertions.assertArrayEquals(new double[] {0.0, 0.5, 1.0}, normalizer.normalize(new double[] {2, 4, 6}), 1e-12);
		Assertions.assertArrayEquals(new double[] {0.0, 0.0, 0.0}, normalizer.normalize(new double[] {5, 5, 5}));
		Assertions.assertEquals(0, normalizer.normalize(new double[0]).length);
		Assertions.assertEquals(0, normalizer.normalize(null).length);
	}

	@Test
	public void testMinMaxWithRange() {
		Normalizer normalizer = Normalizers.findNormalizer("min_max_-1_1");
		Assertions.assertArrayEquals(new double[] {-1.0, 0.0, 1.0}, normalizer.normalize(new double[] {0, 5, 10}), 1e-12);
		Assertions.assertArrayEquals(new double[] {-1.0, -1.0}, normalizer.normalize(new double[] {7, 7}));
		Assertions.assertThrows(IllegalArgumentException.class, () -> Normalizers.findNormalizer("min_max_abc_1"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> Normalizers.findNormalizer("min_max_1"));
	}

	@Test
	public void testZScore() {
		double[] normalized = Normalizers.findNormalizer("z_score").normalize(new double[] {1, 2, 3});
		double expected = 1 / Math.sqrt(2.0 / 3);
		Assertions.assertArrayEquals(new double[] {-expected, 0, expected}, normalized, 1e-9);
		Assertions.assertArrayEquals(new double[] {0, 0}, Normalizers.findNormalizer("z_score").normalize(new double[] {4, 4}));
	}

	@Test
	public void testRMSAndMaxAbs() {
		// rms of [3, -4] is sqrt(12.5)
		double rms = Math.sqrt(12.5);
		Assertions.assertArrayEquals(new double[] {3 / rms, -4 / rms}, Normalizers.findNormalizer("rms").normalize(new double[] {3, -4}), 1e-12);
		Assertions.assertArrayEquals(new double[] {0.75, -1.0}, Normalizers.findNormalizer("max_abs").normalize(new double[] {3, -4}), 1e-12);
		Assertions.assertArrayEquals(new double[] {0, 0}, Normalizers.findNormalizer("max_abs").normalize(new double[] {0, 0}));
		Assertions.assertArrayEquals(new double[] {0, 0}, Normalizers.findNormalizer("rms").normalize(new double[] {0, 0}));
	}

	@Test
	public void testPercentile() {
		double[] values = new double[100];
		for(int i = 0; i < 100; i++) {
			values[i] = i + 1;
		}
		// Bounds are sorted[5] = 6 and sorted[94] = 95
		double[] normalized = Normalizers.findNormalizer("percentile").normalize(values);
		Assertions.assertEquals(0.0, normalized[0]);
		Assertions.assertEquals(0.0, normalized[5]);
		Assertions.assertEquals(1.0, normalized[94]);
		Assertions.assertEquals(1.0, normalized[99]);
		Assertions.assertEquals((50.0 - 6) / (95 - 6), normalized[49], 1e-12);
		for(double value : normalized) {
			Assertions.assertTrue(value >= 0 && value <= 1);
		}

		// Bounds are sorted[10] = 11 and sorted[89] = 90
		double[] custom = Normalizers.findNormalizer("percentile_10_90").normalize(values);
		Assertions.assertEquals(0.0, custom[10]);
		Assertions.assertEquals(1.0, custom[89]);
		Assertions.assertThrows(IllegalArgumentException.class, () -> Normalizers.findNormalizer("percentile_90_10"));
	}

	@Test
	public void testPercentileOfTinyInputs() {
		Normalizer normalizer = new PercentileNormalizer();
		Assertions.assertArrayEquals(new double[] {0.0}, normalizer.normalize(new double[] {42}));
		Assertions.assertArrayEquals(new double[] {0.0, 1.0}, normalizer.normalize(new double[] {1, 2}));
	}

	@Test
	public void testUnknownFallsBackToMinMax() {
		Assertions.assertTrue(Normalizers.findNormalizer("wavelet") instanceof MinMaxNormalizer);
		Assertions.assertTrue(Normalizers.findNormalizer(null) instanceof MinMaxNormalizer);
		Assertions.assertTrue(Normalizers.isKnown("z_score"));
		Assertions.assertFalse(Normalizers.isKnown("wavelet"));
		Assertions.assertEquals(5, Normalizers.getIdentities().size());
	}

	@Test
	public void testInputIsNotModified() {
		double[] values = new double[] {9, 1, 5, 3};
		double[] copy = values.clone();
		for(String identity : Normalizers.getIdentities()) {
			Normalizer normalizer = Normalizers.findNormalizer(identity);
			Assertions.assertEquals(values.length, normalizer.normalize(values).length);
			Assertions.assertNotNull(normalizer.getDescription());
		}
		Assertions.assertArrayEquals(copy, values);
	}
}
