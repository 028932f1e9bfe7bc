package com.acme.testkit.deprecations.count;

import com.acme.testkit.deprecations.config.DeprecationGroup;

/**
 * Metric keys reported by the deprecation collector. Only metrics flagged {@code countsTowardsTotal}
 * contribute to the {@code total} group.
 */
public enum DeprecationMetric {
    UNSILENCED("unsilencedCount", true),
    REMAINING_SELF("remaining selfCount", true),
    REMAINING_DIRECT("remaining directCount", true),
    REMAINING_INDIRECT("remaining indirectCount", true),
    LEGACY("legacyCount", false),
    OTHER("otherCount", true);

    private final String key;
    private final boolean countsTowardsTotal;

    DeprecationMetric(String key, boolean countsTowardsTotal) {
        this.key = key;
        this.countsTowardsTotal = countsTowardsTotal;
    }

    public String key() {
        return key;
    }

    public boolean countsTowardsTotal() {
        return countsTowardsTotal;
    }

    public boolean isRemaining() {
        return this == REMAINING_SELF || this == REMAINING_DIRECT || this == REMAINING_INDIRECT;
    }

    /**
     * Returns the metric holding the remaining count of a sub-group.
     *
     * @throws IllegalArgumentException for {@link DeprecationGroup#TOTAL}, which has no remaining metric
     */
    public static DeprecationMetric remainingFor(DeprecationGroup group) {
        return switch (group) {
            case SELF -> REMAINING_SELF;
            case DIRECT -> REMAINING_DIRECT;
            case INDIRECT -> REMAINING_INDIRECT;
            case TOTAL -> throw new IllegalArgumentException("group total has no remaining metric");
        };
    }

    static DeprecationMetric fromKey(String key) {
        for (DeprecationMetric metric : values()) {
            if (metric.key.equals(key)) {
                return metric;
            }
        }
        return null;
    }
}
