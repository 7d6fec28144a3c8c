package in.brainlog.util;

import java.time.Duration;

/**
 * Configuration lookup: environment variable first, then system property.
 * Blank values count as unset.
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

    public static boolean getBool(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    public static Duration getHours(String key, Duration defaultValue) {
        int hours = getInt(key, -1);
        return hours > 0 ? Duration.ofHours(hours) : defaultValue;
    }

    public static Duration getDays(String key, Duration defaultValue) {
        int days = getInt(key, -1);
        return days > 0 ? Duration.ofDays(days) : defaultValue;
    }

    private Env() {}
}
