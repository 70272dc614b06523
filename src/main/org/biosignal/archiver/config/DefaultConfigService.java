package org.biosignal.archiver.config;

import java.io.FileInputStream;
import java.io.InputStream;
import java.util.LinkedList;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.biosignal.archiver.ChunkStore;
import org.biosignal.archiver.common.SessionLocks;
import org.biosignal.archiver.config.exception.ConfigException;
import org.biosignal.archiver.config.persistence.InMemoryPersistence;
import org.biosignal.archiver.storage.InMemoryChunkStore;

/**
 * This is the default config service for the archiver.
 * <ol>
 * <li>Installation properties are loaded from the file named by the ARCHIVER_PROPERTIES_FILENAME JVM property/environment variable, else from <code>archiver.properties</code> in the classpath.</li>
 * <li>The session persistence layer and the chunk store are instantiated using the class names in ARCHIVER_PERSISTENCE_LAYER and ARCHIVER_CHUNKSTORE.
 * These can also be specified as installation properties.</li>
 * </ol>
 * @author mshankar
 *
 */
public class DefaultConfigService implements ConfigService {
	private static final Logger logger = LogManager.getLogger(DefaultConfigService.class.getName());
	private static final Logger configlogger = LogManager.getLogger("config." + DefaultConfigService.class.getName());

	protected Properties archiverproperties = new Properties();
	protected SessionPersistence sessionPersistence;
	protected ChunkStore chunkStore;
	protected final SessionLocks sessionLocks = new SessionLocks();
	private final LinkedList<Runnable> shutdownHooks = new LinkedList<Runnable>();

	/**
	 * Used by subclasses (typically for unit tests) that set up their own properties and stores.
	 */
	protected DefaultConfigService(boolean skipInitialization) {
	}

	public DefaultConfigService() throws ConfigException {
		loadInstallationProperties();
		initializeStores();
	}

	protected void loadInstallationProperties() throws ConfigException {
		String archiverPropertiesFileName = System.getProperty(ARCHIVER_PROPERTIES_FILENAME);
		if (archiverPropertiesFileName == null) {
			archiverPropertiesFileName = System.getenv(ARCHIVER_PROPERTIES_FILENAME);
		}
		if (archiverPropertiesFileName == null) {
			configlogger.info("Loading " + DEFAULT_ARCHIVER_PROPERTIES_FILENAME + " from the classpath");
			try (InputStream is = this.getClass().getClassLoader().getResourceAsStream(DEFAULT_ARCHIVER_PROPERTIES_FILENAME)) {
				if (is == null) {
					configlogger.warn("Cannot find " + DEFAULT_ARCHIVER_PROPERTIES_FILENAME + " in the classpath; using defaults for all properties");
					return;
				}
				archiverproperties.load(is);
			} catch (Exception ex) {
				throw new ConfigException("Exception loading " + DEFAULT_ARCHIVER_PROPERTIES_FILENAME + " from the classpath", ex);
			}
		} else {
			configlogger.info("Loading installation properties using the environment/JVM property from " + archiverPropertiesFileName);
			try (InputStream is = new FileInputStream(archiverPropertiesFileName)) {
				archiverproperties.load(is);
			} catch (Exception ex) {
				throw new ConfigException("Exception loading installation specific properties file " + archiverPropertiesFileName, ex);
			}
		}
		configlogger.info("Done loading " + archiverproperties.size() + " installation specific properties");
	}

	protected void initializeStores() throws ConfigException {
		String persistenceClassName = lookupSetting(ARCHIVER_PERSISTENCE_LAYER);
		if (persistenceClassName == null || persistenceClassName.isEmpty()) {
			logger.info("Using the default in memory persistence layer for sessions");
			sessionPersistence = new InMemoryPersistence();
		} else {
			configlogger.info("Using " + persistenceClassName + " as the persistence layer for sessions");
			sessionPersistence = instantiate(persistenceClassName, SessionPersistence.class);
		}
		sessionPersistence.initialize(this);

		String chunkStoreClassName = lookupSetting(ARCHIVER_CHUNKSTORE);
		if (chunkStoreClassName == null || chunkStoreClassName.isEmpty()) {
			logger.info("Using the default in memory chunk store");
			chunkStore = new InMemoryChunkStore();
		} else {
			configlogger.info("Using " + chunkStoreClassName + " as the chunk store");
			chunkStore = instantiate(chunkStoreClassName, ChunkStore.class);
		}
		chunkStore.initialize(this);
	}

	private String lookupSetting(String name) {
		String val = System.getProperty(name);
		if (val == null) {
			val = System.getenv(name);
		}
		if (val == null) {
			val = archiverproperties.getProperty(name);
		}
		return val;
	}

	private static <T> T instantiate(String className, Class<T> clazz) throws ConfigException {
		try {
			Object obj = Class.forName(className).getConstructor().newInstance();
			return clazz.cast(obj);
		} catch (Exception ex) {
			throw new ConfigException("Cannot instantiate " + className + " as a " + clazz.getSimpleName(), ex);
		}
	}

	@Override
	public Properties getInstallationProperties() {
		return archiverproperties;
	}

	@Override
	public SessionPersistence getSessionPersistence() {
		return sessionPersistence;
	}

	@Override
	public ChunkStore getChunkStore() {
		return chunkStore;
	}

	@Override
	public SessionLocks getSessionLocks() {
		return sessionLocks;
	}

	@Override
	public void addShutdownHook(Runnable runnable) {
		synchronized (shutdownHooks) {
			shutdownHooks.add(runnable);
		}
	}

	@Override
	public void shutdownNow() {
		LinkedList<Runnable> hooks;
		synchronized (shutdownHooks) {
			hooks = new LinkedList<Runnable>(shutdownHooks);
			shutdownHooks.clear();
		}
		for (Runnable hook : hooks) {
			try {
				hook.run();
			} catch (Exception ex) {
				logger.error("Exception running shutdown hook", ex);
			}
		}
	}
}
