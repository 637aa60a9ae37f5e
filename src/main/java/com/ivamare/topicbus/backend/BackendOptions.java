package com.ivamare.topicbus.backend;

import java.util.Map;

/**
 * Lookup helpers for backend option maps.
 *
 * <p>Options come either from code, keyed as documented ({@code health_check}),
 * or from bound properties, where map keys may arrive in dashed form
 * ({@code health-check}) or with the underscore stripped ({@code healthcheck}).
 * Values bound from properties arrive as strings.
 */
public final class BackendOptions {

    private BackendOptions() {
    }

    /**
     * Find an option under its documented key or one of its bound forms.
     *
     * @param options Option map
     * @param key Documented key, e.g. {@code health_check}
     * @return the value, or null if absent
     */
    public static Object get(Map<String, ?> options, String key) {
        if (options == null) {
            return null;
        }
        Object value = options.get(key);
        if (value == null) {
            value = options.get(key.replace('_', '-'));
        }
        if (value == null) {
            value = options.get(key.replace("_", ""));
        }
        return value;
    }

    public static boolean flag(Map<String, ?> options, String key) {
        Object value = get(options, key);
        return value != null && Boolean.parseBoolean(value.toString());
    }

    public static String string(Map<String, ?> options, String key, String defaultValue) {
        Object value = get(options, key);
        return value != null ? value.toString() : defaultValue;
    }

    public static long number(Map<String, ?> options, String key, long defaultValue) {
        Object value = get(options, key);
        return value != null ? Long.parseLong(value.toString().trim()) : defaultValue;
    }
}
