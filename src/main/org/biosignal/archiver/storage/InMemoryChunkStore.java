package org.biosignal.archiver.storage;

import java.io.IOException;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Predicate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.biosignal.archiver.ChunkStore;
import org.biosignal.archiver.data.ChunkKind;
import org.biosignal.archiver.data.DataChunk;

/**
 * Chunk store that keeps everything in memory; used in the unit tests and for embedded use.
 * Each session has its own map keyed by chunk id; structural changes to one session are done while holding that session's map.
 * @author mshankar
 *
 */
public class InMemoryChunkStore implements ChunkStore {
	private static final Logger logger = LogManager.getLogger(InMemoryChunkStore.class.getName());
	private final ConcurrentHashMap<String, ConcurrentSkipListMap<String, DataChunk>> sessions = new ConcurrentHashMap<String, ConcurrentSkipListMap<String, DataChunk>>();

	@Override
	public void insert(DataChunk chunk) throws IOException {
		ConcurrentSkipListMap<String, DataChunk> chunks = sessions.computeIfAbsent(chunk.getSessionId(), k -> new ConcurrentSkipListMap<String, DataChunk>());
		DataChunk existing = chunks.putIfAbsent(chunk.getChunkId(), chunk);
		if(existing != null) {
			throw new DuplicateKeyException(chunk.getChunkId());
		}
		logger.debug("Inserted " + chunk);
	}

	@Override
	public List<DataChunk> scanByTimeRange(String sessionId, Long start, Long end, int[] channels) throws IOException {
		List<DataChunk> ret = new LinkedList<DataChunk>();
		for(DataChunk chunk : chunksFor(sessionId, c -> c.intersects(start, end))) {
			ret.add(chunk.project(channels));
		}
		ret.sort(ChunkOrdering.BY_INDEX);
		return ret;
	}

	@Override
	public List<DataChunk> scanProvisional(String sessionId) throws IOException {
		List<DataChunk> ret = chunksFor(sessionId, DataChunk::isProvisional);
		ret.sort(ChunkOrdering.BY_ARRIVAL);
		return ret;
	}

	@Override
	public int countProvisional(String sessionId) throws IOException {
		return chunksFor(sessionId, DataChunk::isProvisional).size();
	}

	@Override
	public DataChunk getConsolidated(String sessionId) throws IOException {
		List<DataChunk> consolidated = chunksFor(sessionId, c -> c.getKind() == ChunkKind.CONSOLIDATED);
		return consolidated.isEmpty() ? null : consolidated.get(0);
	}

	@Override
	public int deleteProvisional(String sessionId) throws IOException {
		return removeChunks(sessionId, DataChunk::isProvisional);
	}

	@Override
	public int deleteConsolidated(String sessionId) throws IOException {
		return removeChunks(sessionId, c -> c.getKind() == ChunkKind.CONSOLIDATED);
	}

	@Override
	public int deleteAll(String sessionId) throws IOException {
		ConcurrentSkipListMap<String, DataChunk> chunks = sessions.remove(sessionId);
		return chunks == null ? 0 : chunks.size();
	}

	private List<DataChunk> chunksFor(String sessionId, Predicate<DataChunk> filter) {
		List<DataChunk> ret = new LinkedList<DataChunk>();
		ConcurrentSkipListMap<String, DataChunk> chunks = sessions.get(sessionId);
		if(chunks == null) return ret;
		for(DataChunk chunk : chunks.values()) {
			if(filter.test(chunk)) ret.add(chunk);
		}
		return ret;
	}

	private int removeChunks(String sessionId, Predicate<DataChunk> filter) {
		ConcurrentSkipListMap<String, DataChunk> chunks = sessions.get(sessionId);
		if(chunks == null) return 0;
		int removed = 0;
		synchronized(chunks) {
			for(DataChunk chunk : chunks.values()) {
				if(filter.test(chunk) && chunks.remove(chunk.getChunkId(), chunk)) {
					removed++;
				}
			}
		}
		logger.debug("Removed " + removed + " chunks for session " + sessionId);
		return removed;
	}
}
