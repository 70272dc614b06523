package org.biosignal.archiver.storage;

import java.io.IOException;

/**
 * Thrown by the chunk stores when a chunk with the same (sessionId, chunkIndex, kind) already exists.
 * Typically two uploads for the same session raced on the next provisional index; callers can re-read the count and retry.
 */
public class DuplicateKeyException extends IOException {
	private static final long serialVersionUID = 4190342731245716452L;
	private final String chunkId;

	public DuplicateKeyException(String chunkId) {
		super("Chunk " + chunkId + " already exists");
		this.chunkId = chunkId;
	}

	public DuplicateKeyException(String chunkId, Throwable cause) {
		super("Chunk " + chunkId + " already exists", cause);
		this.chunkId = chunkId;
	}

	public String getChunkId() {
		return chunkId;
	}
}
