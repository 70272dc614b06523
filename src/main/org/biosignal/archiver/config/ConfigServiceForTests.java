package org.biosignal.archiver.config;

import java.io.File;
import java.io.InputStream;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.biosignal.archiver.ChunkStore;
import org.biosignal.archiver.config.persistence.InMemoryPersistence;
import org.biosignal.archiver.storage.InMemoryChunkStore;

/**
 * Config service used by the unit tests.
 * Everything is in memory unless the test passes in its own stores; installation properties come from <code>archiver.properties</code> in the test classpath if present.
 */
public class ConfigServiceForTests extends DefaultConfigService {
    private static final Logger configlogger = LogManager.getLogger("config." + ConfigServiceForTests.class.getName());
    /**
     * All unit test session ids are expected to begin with this.
     */
    public static final String ARCH_UNIT_TEST_SESSION_PREFIX = "ArchUnitTest_";
    public static final String TEST_USER = "unittestuser";

    public ConfigServiceForTests() {
        this(new InMemoryPersistence(), new InMemoryChunkStore());
    }

    public ConfigServiceForTests(SessionPersistence sessionPersistence, ChunkStore chunkStore) {
        super(true);
        try (InputStream is = this.getClass().getClassLoader().getResourceAsStream(DEFAULT_ARCHIVER_PROPERTIES_FILENAME)) {
            if (is != null) {
                archiverproperties.load(is);
                configlogger.info(String.format("loading properties file. %s", DEFAULT_ARCHIVER_PROPERTIES_FILENAME));
            }
        } catch (Exception ex) {
            configlogger.error("Exception loading " + DEFAULT_ARCHIVER_PROPERTIES_FILENAME + " for the unit tests", ex);
        }
        this.sessionPersistence = sessionPersistence;
        this.chunkStore = chunkStore;
        this.sessionPersistence.initialize(this);
        this.chunkStore.initialize(this);
    }

    /**
     * Override an installation property for the duration of a test.
     * @param key Property name
     * @param value Property value
     * @return this, so that calls can be chained
     */
    public ConfigServiceForTests withProperty(String key, String value) {
        archiverproperties.setProperty(key, value);
        return this;
    }

    public ConfigServiceForTests withProperties(Properties props) {
        archiverproperties.putAll(props);
        return this;
    }

    /**
     * Folder for tests that need files, for example SQLite databases.
     * Set ARCHIVER_TEST_FOLDER to override; this defaults to a folder in java.io.tmpdir.
     * @return Folder name
     */
    public static String getDefaultTestFolder() {
        String defaultFolder = System.getenv("ARCHIVER_TEST_FOLDER");
        if (defaultFolder != null) {
            return defaultFolder;
        }
        return System.getProperty("java.io.tmpdir") + File.separator + "BiosignalArchiverTests";
    }
}
