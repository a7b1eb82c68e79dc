package com.devicesync.common.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Layered key/value configuration.
 *
 * Resolution order, highest first: JVM system properties, environment variables
 * ({@code kafka.bootstrap-servers} is looked up as {@code KAFKA_BOOTSTRAP_SERVERS}),
 * then the classpath properties file.
 */
public final class SyncConfig {

    public static final String DEFAULT_RESOURCE = "device-sync.properties";

    private final Properties properties;
    private final Map<String, String> environment;

    SyncConfig(Properties properties, Map<String, String> environment) {
        this.properties = properties;
        this.environment = environment;
    }

    public static SyncConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    public static SyncConfig load(String resource) {
        var props = new Properties();
        try (InputStream in = SyncConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
        return new SyncConfig(props, System.getenv());
    }

    public static SyncConfig of(Properties properties) {
        return new SyncConfig(properties, Map.of());
    }

    public String get(String key, String defaultValue) {
        String value = System.getProperty(key);
        if (value == null) {
            value = environment.get(envName(key));
        }
        if (value == null) {
            value = properties.getProperty(key);
        }
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    public String require(String key) {
        String value = get(key, null);
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key
                + " (or environment variable " + envName(key) + ")");
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Configuration " + key + " is not an integer: " + value, e);
        }
    }

    /**
     * Accepts plain milliseconds ({@code 500}), a unit suffix ({@code 250ms},
     * {@code 5s}, {@code 2m}) or ISO-8601 ({@code PT5S}).
     */
    public Duration getDuration(String key, Duration defaultValue) {
        String value = get(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return parseDuration(value);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalStateException("Configuration " + key + " is not a duration: " + value, e);
        }
    }

    static Duration parseDuration(String value) {
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.startsWith("p")) {
            return Duration.parse(value.trim().toUpperCase(Locale.ROOT));
        }
        if (v.endsWith("ms")) {
            return Duration.ofMillis(Long.parseLong(v.substring(0, v.length() - 2)));
        }
        if (v.endsWith("s")) {
            return Duration.ofSeconds(Long.parseLong(v.substring(0, v.length() - 1)));
        }
        if (v.endsWith("m")) {
            return Duration.ofMinutes(Long.parseLong(v.substring(0, v.length() - 1)));
        }
        return Duration.ofMillis(Long.parseLong(v));
    }

    static String envName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }
}
