package com.acme.testkit.deprecations.config;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Nested scopes of deprecation origin: {@code indirect} contains {@code direct}, which contains
 * {@code self}. {@code total} covers every counted deprecation.
 */
public enum DeprecationGroup {
    TOTAL("total"),
    INDIRECT("indirect"),
    DIRECT("direct"),
    SELF("self");

    private final String key;

    DeprecationGroup(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Resolves a group from its configuration key. Keys are case-sensitive.
     *
     * @throws InvalidConfigurationException when {@code key} names no group
     */
    public static DeprecationGroup fromKey(String key) {
        for (DeprecationGroup group : values()) {
            if (group.key.equals(key)) {
                return group;
            }
        }
        throw new InvalidConfigurationException(
            "Unrecognized threshold \"" + key + "\", expected one of \"" + joinedKeys() + "\"");
    }

    static String joinedKeys() {
        return Arrays.stream(values()).map(DeprecationGroup::key).collect(Collectors.joining("\", \""));
    }
}
