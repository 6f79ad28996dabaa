package dev.nodalis.compiler;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * Compiler defaults, read from {@code nodalis.properties} on the classpath.
 * A JVM system property of the same name overrides each key.
 */
public final class CompilerSettings {

    public static final String RESOURCE = "nodalis.properties";
    public static final String DEFAULT_PLC_NAME = "nodalis.plc.defaultName";
    public static final String TICK_DELAY_MILLIS = "nodalis.scheduler.tickDelayMillis";
    public static final String FALLBACK_INTERVAL_MILLIS = "nodalis.scheduler.fallbackIntervalMillis";

    private final String defaultPlcName;
    private final long tickDelayMillis;
    private final long fallbackIntervalMillis;

    public CompilerSettings(String defaultPlcName, long tickDelayMillis, long fallbackIntervalMillis) {
        this.defaultPlcName = Objects.requireNonNull(defaultPlcName, "defaultPlcName");
        if (tickDelayMillis < 0) {
            throw new IllegalArgumentException(TICK_DELAY_MILLIS + " must not be negative: " + tickDelayMillis);
        }
        if (fallbackIntervalMillis <= 0) {
            throw new IllegalArgumentException(FALLBACK_INTERVAL_MILLIS + " must be positive: " + fallbackIntervalMillis);
        }
        this.tickDelayMillis = tickDelayMillis;
        this.fallbackIntervalMillis = fallbackIntervalMillis;
    }

    public static CompilerSettings load() {
        Properties properties = new Properties();
        try (InputStream in = CompilerSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + RESOURCE, e);
        }
        return from(properties, System.getProperties());
    }

    static CompilerSettings from(Properties defaults, Properties overrides) {
        return new CompilerSettings(
                value(DEFAULT_PLC_NAME, defaults, overrides, "NodalisPLC"),
                millis(TICK_DELAY_MILLIS, defaults, overrides, "1"),
                millis(FALLBACK_INTERVAL_MILLIS, defaults, overrides, "100"));
    }

    private static long millis(String key, Properties defaults, Properties overrides, String fallback) {
        String value = value(key, defaults, overrides, fallback);
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a whole number of milliseconds: '" + value + "'", e);
        }
    }

    private static String value(String key, Properties defaults, Properties overrides, String fallback) {
        String value = overrides.getProperty(key);
        if (value == null) {
            value = defaults.getProperty(key, fallback);
        }
        return value.trim();
    }

    /**
     * Runtime name for sources compiled without a resource name.
     */
    public String getDefaultPlcName() {
        return defaultPlcName;
    }

    public long getTickDelayMillis() {
        return tickDelayMillis;
    }

    public long getFallbackIntervalMillis() {
        return fallbackIntervalMillis;
    }
}
