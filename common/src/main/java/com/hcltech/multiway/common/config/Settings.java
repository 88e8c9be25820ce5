package com.hcltech.multiway.common.config;

import com.hcltech.multiway.common.errorsor.ErrorsOr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * Layered key/value settings. A key resolves from the environment first, then
 * system properties, then the properties file, then the caller's default.
 */
public final class Settings {
    private static final Logger log = LoggerFactory.getLogger(Settings.class);

    public static final String DEFAULT_RESOURCE = "multiway.properties";

    private final IEnvGetter env;
    private final Properties system;
    private final Properties file;

    public Settings(IEnvGetter env, Properties system, Properties file) {
        this.env = Objects.requireNonNull(env);
        this.system = Objects.requireNonNull(system);
        this.file = Objects.requireNonNull(file);
    }

    /** Process environment + system properties + {@value #DEFAULT_RESOURCE} from the classpath. */
    public static Settings load() {
        return new Settings(IEnvGetter.env, System.getProperties(), loadResource(DEFAULT_RESOURCE));
    }

    static Properties loadResource(String resource) {
        Properties props = new Properties();
        try (InputStream is = Settings.class.getClassLoader().getResourceAsStream(resource)) {
            if (is != null) props.load(is);
            else log.debug("No {} on the classpath; using built-in defaults", resource);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + resource, e);
        }
        return props;
    }

    public String getString(String key, String defaultValue) {
        String fromEnv = env.get(IEnvGetter.toEnvKey(key));
        if (fromEnv != null && !fromEnv.isBlank()) return fromEnv.trim();
        String fromSys = system.getProperty(key);
        if (fromSys != null && !fromSys.isBlank()) return fromSys.trim();
        String fromFile = file.getProperty(key);
        if (fromFile != null && !fromFile.isBlank()) return fromFile.trim();
        return defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for setting: " + key + " = '" + value + "'", e);
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = getString(key, null);
        if (value == null) return defaultValue;
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid number for setting: " + key + " = '" + value + "'", e);
        }
    }

    /** As {@link #getInt}, with a bad value reported as an error naming the key. */
    public ErrorsOr<Integer> getIntOr(String key, int defaultValue) {
        return ErrorsOr.trying("{1}", () -> getInt(key, defaultValue));
    }

    public ErrorsOr<Double> getDoubleOr(String key, double defaultValue) {
        return ErrorsOr.trying("{1}", () -> getDouble(key, defaultValue));
    }
}
