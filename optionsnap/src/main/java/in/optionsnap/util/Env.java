package in.optionsnap.util;

import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;

/**
 * Environment variable utilities.
 *
 * Values are looked up in the process environment first, then in JVM system
 * properties (handy for tests and -D overrides). Unparseable values fall back
 * to the supplied default.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static long getLong(String key, long defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static boolean getBool(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    public static Duration getSeconds(String key, long defaultSeconds) {
        return Duration.ofSeconds(getLong(key, defaultSeconds));
    }

    public static Duration getMillis(String key, long defaultMillis) {
        return Duration.ofMillis(getLong(key, defaultMillis));
    }

    /**
     * Reads a wall-clock time in {@code HH:mm} form.
     */
    public static LocalTime getTime(String key, LocalTime defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return LocalTime.parse(value);
        } catch (DateTimeParseException e) {
            return defaultValue;
        }
    }

    private Env() {}
}
