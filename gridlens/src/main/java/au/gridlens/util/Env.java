package au.gridlens.util;

import java.util.Arrays;
import java.util.Locale;

/**
 * Environment variable utilities.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isEmpty() ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + key + ": " + value, e);
        }
    }

    public static long getLong(String key, long defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid long for " + key + ": " + value, e);
        }
    }

    /**
     * Enum constant by case-insensitive name; an unknown name fails startup with the allowed values.
     */
    public static <E extends Enum<E>> E getEnum(String key, Class<E> type, E defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid value for " + key + ": " + value
                    + " (expected one of " + Arrays.toString(type.getEnumConstants()) + ")", e);
        }
    }

    private Env() {}
}
