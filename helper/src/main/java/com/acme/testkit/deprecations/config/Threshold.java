package com.acme.testkit.deprecations.config;

/**
 * Upper bound on a deprecation count. {@link #UNBOUNDED} never rejects a count.
 */
public record Threshold(boolean bounded, long ceiling) {
    public static final Threshold UNBOUNDED = new Threshold(false, 0L);

    public Threshold {
        if (!bounded && ceiling != 0L) {
            throw new IllegalArgumentException("unbounded threshold carries no ceiling");
        }
    }

    public static Threshold atMost(long ceiling) {
        return new Threshold(true, ceiling);
    }

    public boolean exceededBy(long count) {
        return bounded && count > ceiling;
    }

    @Override
    public String toString() {
        return bounded ? "<=" + ceiling : "unbounded";
    }
}
