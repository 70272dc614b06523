package org.biosignal.archiver.retrieval.conditioning;

import org.apache.commons.lang3.StringUtils;

/**
 * Parses the numeric parameters that follow a normalizer identity; <code>min_max_-1_1</code> gives [-1, 1].
 */
class NormalizerArgs {
	static double[] parse(String userarg, String identity) {
		if(userarg == null || !userarg.startsWith(identity)) return new double[0];
		String rest = StringUtils.removeStart(userarg.substring(identity.length()), "_");
		if(StringUtils.isBlank(rest)) return new double[0];
		String[] parts = rest.split("_");
		double[] ret = new double[parts.length];
		for(int i = 0; i < parts.length; i++) {
			try {
				ret[i] = Double.parseDouble(parts[i]);
			} catch(NumberFormatException ex) {
				throw new IllegalArgumentException("Cannot parse parameter " + parts[i] + " in " + userarg, ex);
			}
		}
		return ret;
	}
}
