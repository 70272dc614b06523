package org.biosignal.archiver.storage;

import org.biosignal.archiver.ChunkStore;
import org.junit.jupiter.api.BeforeEach;

public class InMemoryChunkStoreTest extends ChunkStoreTestBase {
	private InMemoryChunkStore store;

	@BeforeEach
	public void setUp() {
		store = new InMemoryChunkStore();
	}

	@Override
	protected ChunkStore getChunkStore() {
		return store;
	}
}
