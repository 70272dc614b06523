package org.biosignal.archiver.etl;

/**
 * The steps of consolidating a session, in order.
 * Each step can be repeated safely, so a finalization that was interrupted can be resumed by calling finalize again.
 * <ol>
 * <li>PENDING: nothing has been done.</li>
 * <li>SAMPLES_MERGED: the provisional chunks have been merged and sorted in memory.</li>
 * <li>CONSOLIDATED_WRITTEN: the consolidated chunk is in the chunk store; the provisional chunks are still there.</li>
 * <li>PROVISIONAL_PURGED: the provisional chunks have been removed.</li>
 * <li>SESSION_COMPLETED: the session record is marked completed.</li>
 * </ol>
 * @author mshankar
 *
 */
public enum FinalizationState {
	PENDING,
	SAMPLES_MERGED,
	CONSOLIDATED_WRITTEN,
	PROVISIONAL_PURGED,
	SESSION_COMPLETED;

	public boolean isAfter(FinalizationState other) {
		return this.ordinal() > other.ordinal();
	}
}
