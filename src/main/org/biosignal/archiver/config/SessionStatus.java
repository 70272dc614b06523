package org.biosignal.archiver.config;

/**
 * Lifecycle of a recording session.
 * A session starts out <code>ACTIVE</code> and moves to one of the terminal states exactly once.
 */
public enum SessionStatus {
	ACTIVE("active"),
	COMPLETED("completed"),
	ERROR("error");

	private final String externalName;

	private SessionStatus(String externalName) {
		this.externalName = externalName;
	}

	public String getExternalName() {
		return externalName;
	}

	public boolean isTerminal() {
		return this != ACTIVE;
	}

	public static SessionStatus fromExternalName(String name) {
		for(SessionStatus status : SessionStatus.values()) {
			if(status.externalName.equalsIgnoreCase(name) || status.name().equalsIgnoreCase(name)) {
				return status;
			}
		}
		throw new IllegalArgumentException("Unknown session status " + name);
	}
}
