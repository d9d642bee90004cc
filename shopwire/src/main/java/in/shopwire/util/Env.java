package in.shopwire.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Environment variable utilities. System properties are consulted when the
 * variable is unset, which is how tests override values.
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
            return defaultValue;
        }
    }

    public static long getLong(String key, long defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public static boolean getBool(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    /**
     * Comma-separated list; blank entries are dropped.
     */
    public static List<String> getList(String key, List<String> defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        List<String> items = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                items.add(part.trim());
            }
        }
        return items.isEmpty() ? defaultValue : List.copyOf(items);
    }

    private Env() {}
}
