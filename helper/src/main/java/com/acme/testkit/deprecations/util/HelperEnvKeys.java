package com.acme.testkit.deprecations.util;

/**
 * Canonical environment variable names read by the deprecation helper.
 */
public final class HelperEnvKeys {
    /** Mode string: {@code strict}, {@code weak}, {@code disabled}, a number, a regex or a query string. */
    public static final String DEPRECATIONS_HELPER = "DEPRECATIONS_HELPER";
    public static final String DEPRECATIONS_COUNTS_FILE = "DEPRECATIONS_COUNTS_FILE";

    public static final String DEFAULT_COUNTS_FILE = "build/deprecations/counts.json";

    private HelperEnvKeys() {
    }
}
