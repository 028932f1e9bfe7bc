package com.acme.testkit.deprecations.util;

import java.util.Map;

/**
 * Environment lookups with blank-as-missing defaulting.
 *
 * <p>Every lookup has a {@code Map}-taking overload so callers can be exercised without touching
 * the process environment.</p>
 */
public final class EnvVars {
    private EnvVars() {
    }

    public static String getOrDefault(Map<String, String> env, String name, String defaultValue) {
        String v = env.get(name);
        return (v == null || v.isBlank()) ? defaultValue : v;
    }

    public static String getTrimmedOrNull(Map<String, String> env, String name) {
        String v = env.get(name);
        return (v == null || v.isBlank()) ? null : v.trim();
    }
}
