package org.biosignal.archiver.data;

/**
 * Provisional chunks are written one per ingested batch and are superseded when the session is consolidated.
 * A completed session has exactly one consolidated chunk.
 */
public enum ChunkKind {
	PROVISIONAL("provisional"),
	CONSOLIDATED("consolidated");

	private final String externalName;

	private ChunkKind(String externalName) {
		this.externalName = externalName;
	}

	public String getExternalName() {
		return externalName;
	}

	public static ChunkKind fromExternalName(String name) {
		for(ChunkKind kind : ChunkKind.values()) {
			if(kind.externalName.equalsIgnoreCase(name) || kind.name().equalsIgnoreCase(name)) {
				return kind;
			}
		}
		throw new IllegalArgumentException("Unknown chunk kind " + name);
	}
}
