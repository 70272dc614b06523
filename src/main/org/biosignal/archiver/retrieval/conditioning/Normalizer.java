package org.biosignal.archiver.retrieval.conditioning;

/**
 * A normalization strategy; a pure function from a sequence of values to a rescaled sequence of the same length.
 * Normalizers are identified by a string; parameters follow the identity separated by underscores, for example <code>percentile_10_90</code>.
 * @author mshankar
 *
 */
public interface Normalizer {
	public String getIdentity();

	/**
	 * Parse any parameters from the user argument; the default is to have no parameters.
	 * @param userarg The full argument, starting with the identity.
	 */
	default void initialize(String userarg) {
	}

	/**
	 * @param values Input; not modified
	 * @return A new array; empty if the input is null or empty
	 */
	public double[] normalize(double[] values);

	public String getDescription();
}
