package com.acme.testkit.deprecations.count;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Deprecation counts observed during a test run, keyed by {@link DeprecationMetric}.
 *
 * <p>The three remaining-count metrics are mandatory; any other metric that was not reported
 * counts as zero.</p>
 */
public final class DeprecationCounts {
    private final Map<DeprecationMetric, Long> counts;

    private DeprecationCounts(EnumMap<DeprecationMetric, Long> counts) {
        this.counts = Collections.unmodifiableMap(counts);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds counts from the collector's string-keyed metric map, e.g.
     * {@code {"unsilencedCount": 0, "remaining selfCount": 3, ...}}.
     *
     * @throws IllegalArgumentException on an unrecognized metric key, a missing remaining count, or a count that is
     *                                  negative, fractional or outside the {@code long} range
     */
    public static DeprecationCounts fromMetricMap(Map<String, ? extends Number> metrics) {
        Objects.requireNonNull(metrics, "metrics");
        Builder builder = builder();
        for (Map.Entry<String, ? extends Number> entry : metrics.entrySet()) {
            DeprecationMetric metric = DeprecationMetric.fromKey(entry.getKey());
            if (metric == null) {
                throw new IllegalArgumentException("Unrecognized deprecation metric \"" + entry.getKey()
                    + "\", expected one of \"" + joinedKeys() + "\"");
            }
            builder.set(metric, exactCount(entry.getKey(), entry.getValue()));
        }
        return builder.build();
    }

    public long get(DeprecationMetric metric) {
        return counts.getOrDefault(metric, 0L);
    }

    /**
     * Sum of every metric that counts towards the total, saturating at {@link Long#MAX_VALUE}.
     */
    public long total() {
        long sum = 0L;
        for (Map.Entry<DeprecationMetric, Long> entry : counts.entrySet()) {
            if (entry.getKey().countsTowardsTotal()) {
                long next = sum + entry.getValue();
                sum = next < sum ? Long.MAX_VALUE : next;
            }
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DeprecationCounts other && counts.equals(other.counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return "DeprecationCounts" + counts;
    }

    private static long exactCount(String key, Number value) {
        Objects.requireNonNull(value, key);
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return value.longValue();
        }
        if (value instanceof BigInteger big) {
            try {
                return big.longValueExact();
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Count for metric \"" + key + "\" is out of range: " + big, e);
            }
        }
        throw new IllegalArgumentException("Count for metric \"" + key + "\" is not an integer: " + value);
    }

    private static String joinedKeys() {
        return Arrays.stream(DeprecationMetric.values()).map(DeprecationMetric::key).collect(Collectors.joining("\", \""));
    }

    public static final class Builder {
        private final EnumMap<DeprecationMetric, Long> counts = new EnumMap<>(DeprecationMetric.class);

        private Builder() {
        }

        public Builder set(DeprecationMetric metric, long count) {
            Objects.requireNonNull(metric, "metric");
            if (count < 0) {
                throw new IllegalArgumentException("Count for metric \"" + metric.key() + "\" is negative: " + count);
            }
            counts.put(metric, count);
            return this;
        }

        /**
         * @throws IllegalArgumentException when a remaining-count metric was never set
         */
        public DeprecationCounts build() {
            for (DeprecationMetric metric : DeprecationMetric.values()) {
                if (metric.isRemaining() && !counts.containsKey(metric)) {
                    throw new IllegalArgumentException("Missing required deprecation metric \"" + metric.key() + "\"");
                }
            }
            return new DeprecationCounts(new EnumMap<>(counts));
        }
    }
}
