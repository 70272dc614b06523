/*******************************************************************************
 * Copyright (c) 2011 The Board of Trustees of the Leland Stanford Junior University
 * as Operator of the SLAC National Accelerator Laboratory.
 * Copyright (c) 2011 Brookhaven National Laboratory.
 * EPICS archiver appliance is distributed subject to a Software License Agreement found
 * in file LICENSE that is included with this distribution.
 *******************************************************************************/
package org.biosignal.archiver.config;

import java.util.Properties;

import org.biosignal.archiver.ChunkStore;
import org.biosignal.archiver.common.SessionLocks;

/**
 * Interface for the configuration of one archiver instance.
 * This holds the installation properties, the session persistence layer and the chunk store that the ingestion, consolidation and retrieval components share.
 * @author mshankar
 *
 */
public interface ConfigService {
	/**
	 * Use this property (JVM property or environment variable) to point to the installation specific properties file.
	 * If this is not set, we load <code>archiver.properties</code> from the classpath.
	 */
	public static final String ARCHIVER_PROPERTIES_FILENAME = "ARCHIVER_PROPERTIES_FILENAME";
	public static final String DEFAULT_ARCHIVER_PROPERTIES_FILENAME = "archiver.properties";

	/**
	 * Class name of the {@link SessionPersistence} implementation.
	 * Defaults to {@link org.biosignal.archiver.config.persistence.InMemoryPersistence}
	 */
	public static final String ARCHIVER_PERSISTENCE_LAYER = "ARCHIVER_PERSISTENCE_LAYER";

	/**
	 * Class name of the {@link ChunkStore} implementation.
	 * Defaults to {@link org.biosignal.archiver.storage.InMemoryChunkStore}
	 */
	public static final String ARCHIVER_CHUNKSTORE = "ARCHIVER_CHUNKSTORE";

	/**
	 * Get the installation specific properties.
	 * Components read their tunables from here using keys that start with their package name.
	 * @return Properties
	 */
	public Properties getInstallationProperties();

	public SessionPersistence getSessionPersistence();

	public ChunkStore getChunkStore();

	/**
	 * Per session advisory locks; the finalizer holds one while consolidating a session.
	 * @return SessionLocks
	 */
	public SessionLocks getSessionLocks();

	/**
	 * Register a task to run when the archiver shuts down; for example, closing JDBC connections.
	 * @param runnable Runnable
	 */
	public void addShutdownHook(Runnable runnable);

	/**
	 * Run all the shutdown hooks.
	 */
	public void shutdownNow();

	default int getIntProperty(String key, int defaultValue) {
		String val = getInstallationProperties().getProperty(key);
		if(val == null || val.trim().isEmpty()) return defaultValue;
		return Integer.parseInt(val.trim());
	}

	default long getLongProperty(String key, long defaultValue) {
		String val = getInstallationProperties().getProperty(key);
		if(val == null || val.trim().isEmpty()) return defaultValue;
		return Long.parseLong(val.trim());
	}

	default double getDoubleProperty(String key, double defaultValue) {
		String val = getInstallationProperties().getProperty(key);
		if(val == null || val.trim().isEmpty()) return defaultValue;
		return Double.parseDouble(val.trim());
	}

	default boolean getBooleanProperty(String key, boolean defaultValue) {
		String val = getInstallationProperties().getProperty(key);
		if(val == null || val.trim().isEmpty()) return defaultValue;
		return Boolean.parseBoolean(val.trim());
	}
}
