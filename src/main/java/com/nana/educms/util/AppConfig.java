package com.nana.educms.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * AppConfig - Backend Configuration
 *
 * <p>Layers, lowest precedence first: built-in defaults, classpath
 * {@code educms.properties}, the external file named by
 * {@code -Deducms.config}, then {@code -D} system properties for any known key.
 */
public final class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    public static final String KEY_DB_URL               = "db.url";
    public static final String KEY_DB_BUSY_TIMEOUT_MS   = "db.busy.timeout.ms";
    public static final String KEY_EXECUTOR_POOL_SIZE   = "executor.pool.size";
    public static final String KEY_LOAD_SAMPLE_DATA     = "startup.load.sample.data";

    /** System property naming an external properties file. */
    public static final String SYS_CONFIG_FILE          = "educms.config";

    static final String CLASSPATH_RESOURCE = "educms.properties";

    public static final int DEFAULT_BUSY_TIMEOUT_MS = 5000;
    public static final int DEFAULT_POOL_SIZE       = 4;

    private static final Properties DEFAULTS = new Properties();

    static {
        DEFAULTS.setProperty(KEY_DB_URL,             "jdbc:sqlite:" + Paths.get(
                System.getProperty("user.home"), ".educms", "educms.db").toAbsolutePath());
        DEFAULTS.setProperty(KEY_DB_BUSY_TIMEOUT_MS, String.valueOf(DEFAULT_BUSY_TIMEOUT_MS));
        DEFAULTS.setProperty(KEY_EXECUTOR_POOL_SIZE, String.valueOf(DEFAULT_POOL_SIZE));
        DEFAULTS.setProperty(KEY_LOAD_SAMPLE_DATA,   "false");
    }

    private static AppConfig instance;

    public static synchronized AppConfig getInstance() {
        if (instance == null) {
            instance = new AppConfig(new Properties());
        }
        return instance;
    }

    private final Properties props;

    /**
     * Builds a configuration with {@code overrides} on top of every other layer.
     * Used by tests and by embedders that configure the backend in code.
     */
    public AppConfig(Properties overrides) {
        props = new Properties(DEFAULTS);
        loadClasspathProperties();
        loadExternalProperties();
        applySystemProperties();
        if (overrides != null) {
            for (String key : overrides.stringPropertyNames()) {
                props.setProperty(key, overrides.getProperty(key));
            }
        }
        log.info("AppConfig loaded. Database URL: {}", props.getProperty(KEY_DB_URL));
    }

    public String getString(String key) {
        return props.getProperty(key);
    }

    public int getInt(String key, int defaultValue) {
        try {
            return Integer.parseInt(props.getProperty(key, "").trim());
        } catch (NumberFormatException ex) {
            log.warn("Config key {} is not an integer ('{}'); using {}.",
                    key, props.getProperty(key), defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key) {
        String val = props.getProperty(key, "false").toLowerCase().trim();
        return val.equals("true") || val.equals("yes") || val.equals("1");
    }

    public void set(String key, String value) {
        props.setProperty(key, value);
    }

    private void loadClasspathProperties() {
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in == null) {
                log.debug("{} not found on classpath; using defaults.", CLASSPATH_RESOURCE);
                return;
            }
            props.load(in);
        } catch (IOException ex) {
            log.warn("Failed to load {}: {}", CLASSPATH_RESOURCE, ex.getMessage());
        }
    }

    private void loadExternalProperties() {
        String file = System.getProperty(SYS_CONFIG_FILE);
        if (file == null || file.isBlank()) {
            return;
        }
        Path path = Paths.get(file);
        if (!Files.exists(path)) {
            log.warn("External config file {} does not exist; ignoring.", path.toAbsolutePath());
            return;
        }
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
            log.info("Loaded external config from {}", path.toAbsolutePath());
        } catch (IOException ex) {
            log.warn("Failed to load external config {}: {}", path, ex.getMessage());
        }
    }

    private void applySystemProperties() {
        for (String key : DEFAULTS.stringPropertyNames()) {
            String value = System.getProperty(key);
            if (value != null) {
                props.setProperty(key, value);
            }
        }
    }
}
