package org.biosignal.archiver.storage;

import java.util.Comparator;

import org.biosignal.archiver.data.DataChunk;

/**
 * Orderings shared by the chunk stores.
 */
public class ChunkOrdering {
	/**
	 * By chunk index; consolidated before provisional for the same index.
	 */
	public static final Comparator<DataChunk> BY_INDEX = Comparator.comparingInt(DataChunk::getChunkIndex)
			.thenComparing(chunk -> chunk.isProvisional() ? 1 : 0);

	public static final Comparator<DataChunk> BY_ARRIVAL = Comparator.comparingInt(DataChunk::getArrivalOrder);
}
