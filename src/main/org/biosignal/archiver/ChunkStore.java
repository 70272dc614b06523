/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.biosignal.archiver;

import java.io.IOException;
import java.util.List;

import org.biosignal.archiver.config.ConfigService;
import org.biosignal.archiver.data.DataChunk;

/**
 * The main interface for storing data chunks; this is session partitioned and time indexed.
 * Chunks are identified by (sessionId, chunkIndex, kind); implementations enforce uniqueness on this key.
 * <ol>
 * <li>The config service instantiates the chunk store using the default constructor.</li>
 * <li>Calls initialize with itself.</li>
 * </ol>
 * @author mshankar
 *
 */
public interface ChunkStore {
	/**
	 * Called once by the config service after construction; register shutdown hooks etc here.
	 * @param configService ConfigService
	 */
	default void initialize(ConfigService configService) {
	}

	/**
	 * Add a chunk.
	 * @param chunk DataChunk
	 * @throws org.biosignal.archiver.storage.DuplicateKeyException if a chunk with the same session, index and kind exists.
	 * @throws IOException &emsp;
	 */
	public void insert(DataChunk chunk) throws IOException;

	/**
	 * Get the chunks whose interval intersects [start, end], ordered by chunk index.
	 * For the same index, the consolidated chunk comes before the provisional one.
	 * @param sessionId Session
	 * @param start Epoch millis; null means no lower bound
	 * @param end Epoch millis; null means no upper bound
	 * @param channels If not null, the chunks are projected to just these channels
	 * @return List of chunks; empty if there are none
	 * @throws IOException &emsp;
	 */
	public List<DataChunk> scanByTimeRange(String sessionId, Long start, Long end, int[] channels) throws IOException;

	/**
	 * Get all the provisional chunks for a session ordered by arrival order.
	 * @param sessionId Session
	 * @return List of chunks
	 * @throws IOException &emsp;
	 */
	public List<DataChunk> scanProvisional(String sessionId) throws IOException;

	public int countProvisional(String sessionId) throws IOException;

	/**
	 * @param sessionId Session
	 * @return The consolidated chunk for this session, null if the session has not been consolidated.
	 * @throws IOException &emsp;
	 */
	public DataChunk getConsolidated(String sessionId) throws IOException;

	/**
	 * Remove all provisional chunks for the session in one step.
	 * @param sessionId Session
	 * @return Number of chunks removed
	 * @throws IOException &emsp;
	 */
	public int deleteProvisional(String sessionId) throws IOException;

	/**
	 * Remove the consolidated chunk, if any.
	 * @param sessionId Session
	 * @return Number of chunks removed
	 * @throws IOException &emsp;
	 */
	public int deleteConsolidated(String sessionId) throws IOException;

	/**
	 * Remove every chunk for the session; used when deleting a session.
	 * @param sessionId Session
	 * @return Number of chunks removed
	 * @throws IOException &emsp;
	 */
	public int deleteAll(String sessionId) throws IOException;
}
