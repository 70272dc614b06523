package org.biosignal.archiver.retrieval.conditioning;

import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Factory class for normalizers.
 * We use startsWith on the identity, so no identity should be a prefix of another.
 * Unknown identities fall back to min_max.
 * @author mshankar
 *
 */
public class Normalizers {
	private static final Logger logger = LogManager.getLogger(Normalizers.class.getName());
	public static final String DEFAULT_NORMALIZER = MinMaxNormalizer.IDENTITY;

	private static final LinkedHashMap<String, Supplier<Normalizer>> normalizers = new LinkedHashMap<String, Supplier<Normalizer>>();

	static {
		normalizers.put(MinMaxNormalizer.IDENTITY, MinMaxNormalizer::new);
		normalizers.put(ZScoreNormalizer.IDENTITY, ZScoreNormalizer::new);
		normalizers.put(RMSNormalizer.IDENTITY, RMSNormalizer::new);
		normalizers.put(MaxAbsNormalizer.IDENTITY, MaxAbsNormalizer::new);
		normalizers.put(PercentileNormalizer.IDENTITY, PercentileNormalizer::new);
	}

	/**
	 * @param normalizerUserArg Identity, optionally followed by parameters.
	 * @return A new initialized normalizer; min_max if we do not recognize the identity.
	 * @throws IllegalArgumentException if the identity is known but the parameters are not valid.
	 */
	public static Normalizer findNormalizer(String normalizerUserArg) {
		if(normalizerUserArg != null) {
			for(String identity : normalizers.keySet()) {
				if(normalizerUserArg.startsWith(identity)) {
					Normalizer normalizer = normalizers.get(identity).get();
					normalizer.initialize(normalizerUserArg);
					logger.debug("Found normalizer for " + normalizerUserArg);
					return normalizer;
				}
			}
		}
		logger.warn("Did not find normalizer for " + normalizerUserArg + "; defaulting to " + DEFAULT_NORMALIZER);
		return new MinMaxNormalizer();
	}

	public static boolean isKnown(String identity) {
		return identity != null && normalizers.containsKey(identity);
	}

	public static List<String> getIdentities() {
		return new LinkedList<String>(normalizers.keySet());
	}
}
