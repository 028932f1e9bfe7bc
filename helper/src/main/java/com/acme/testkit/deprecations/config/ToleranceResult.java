package com.acme.testkit.deprecations.config;

/**
 * Verdict of {@link Configuration#check}. {@link Exceeded} names the first group whose threshold
 * was crossed, checked in the order total, self, direct, indirect.
 */
public sealed interface ToleranceResult permits ToleranceResult.Tolerated, ToleranceResult.Exceeded {
    ToleranceResult TOLERATED = new Tolerated();

    boolean tolerated();

    record Tolerated() implements ToleranceResult {
        @Override
        public boolean tolerated() {
            return true;
        }
    }

    record Exceeded(DeprecationGroup group, long count, Threshold threshold) implements ToleranceResult {
        @Override
        public boolean tolerated() {
            return false;
        }

        public String reason() {
            return group.key() + "_above_threshold";
        }
    }
}
