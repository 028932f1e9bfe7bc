package com.acme.testkit.deprecations.config;

import com.acme.testkit.deprecations.count.DeprecationCounts;
import com.acme.testkit.deprecations.count.DeprecationMetric;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Deprecation reporting settings for one test run.
 *
 * <p>Answers whether the observed deprecation counts are tolerated and whether a given deprecation
 * message should get a stack trace. Instances come from the named factories only and do not change
 * after construction.</p>
 */
public final class Configuration {
    private static final Logger LOG = Logger.getLogger(Configuration.class.getName());

    private static final Set<String> OPTIONS = Set.of("max", "disabled", "verbose");
    private static final Pattern NUMERIC = Pattern.compile("\\s*[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d{1,3})?\\s*");
    private static final DeprecationGroup[] SUB_GROUPS = {
        DeprecationGroup.SELF,
        DeprecationGroup.DIRECT,
        DeprecationGroup.INDIRECT
    };

    private final Map<DeprecationGroup, Threshold> thresholds;
    private final String regex;
    private final boolean enabled;
    private final boolean verboseOutput;
    private volatile Pattern compiledRegex;

    private Configuration(Map<String, String> rawThresholds, String regex, boolean verboseOutput, boolean enabled) {
        Objects.requireNonNull(rawThresholds, "rawThresholds");
        Objects.requireNonNull(regex, "regex");

        EnumMap<DeprecationGroup, Threshold> resolved = new EnumMap<>(DeprecationGroup.class);
        for (Map.Entry<String, String> entry : rawThresholds.entrySet()) {
            DeprecationGroup group = DeprecationGroup.fromKey(entry.getKey());
            resolved.put(group, Threshold.atMost(parseThreshold(group, entry.getValue())));
        }
        if (resolved.containsKey(DeprecationGroup.DIRECT)) {
            resolved.putIfAbsent(DeprecationGroup.SELF, resolved.get(DeprecationGroup.DIRECT));
        }
        if (resolved.containsKey(DeprecationGroup.INDIRECT)) {
            resolved.putIfAbsent(DeprecationGroup.DIRECT, resolved.get(DeprecationGroup.INDIRECT));
            resolved.putIfAbsent(DeprecationGroup.SELF, resolved.get(DeprecationGroup.INDIRECT));
        }
        for (DeprecationGroup group : DeprecationGroup.values()) {
            resolved.putIfAbsent(group, Threshold.UNBOUNDED);
        }

        this.thresholds = Collections.unmodifiableMap(resolved);
        this.regex = regex;
        this.verboseOutput = verboseOutput;
        this.enabled = enabled;
    }

    private Configuration(Map<String, String> rawThresholds, String regex, boolean verboseOutput) {
        this(rawThresholds, regex, verboseOutput, true);
    }

    /**
     * Parses settings such as {@code max[total]=1234&max[indirect]=42&verbose=0}.
     *
     * <p>Recognized options are {@code max}, a map of group to threshold; {@code disabled}, whose
     * presence alone disables tracking; and {@code verbose}, false for {@code ""} and {@code "0"}.</p>
     *
     * @throws InvalidConfigurationException on an unknown option, group or malformed threshold
     */
    public static Configuration fromUrlEncodedString(String serializedConfiguration) {
        UrlEncodedOptions options = UrlEncodedOptions.parse(serializedConfiguration);
        for (String key : options.keys()) {
            if (!OPTIONS.contains(key)) {
                throw new InvalidConfigurationException("Unknown configuration option \"" + key + "\"");
            }
        }

        if (options.has("disabled")) {
            return inDisabledMode();
        }

        boolean verboseOutput = true;
        if (options.has("verbose")) {
            String verbose = options.scalar("verbose");
            verboseOutput = !verbose.isEmpty() && !verbose.equals("0");
        }

        Configuration configuration = new Configuration(new LinkedHashMap<>(options.nested("max")), "", verboseOutput);
        LOG.fine(() -> "Parsed deprecation configuration " + configuration);
        return configuration;
    }

    public static Configuration inDisabledMode() {
        return new Configuration(Map.of(), "", true, false);
    }

    public static Configuration inStrictMode() {
        return fromNumber(0);
    }

    public static Configuration inWeakMode() {
        return new Configuration(Map.of(), "", false);
    }

    public static Configuration fromNumber(long upperBound) {
        return new Configuration(Map.of(DeprecationGroup.TOTAL.key(), Long.toString(upperBound)), "", true);
    }

    /**
     * @param regex delimited pattern, e.g. {@code /Foo/} or {@code #bar#i}; matched against each
     *              deprecation message to decide whether to display its stack trace
     */
    public static Configuration fromRegex(String regex) {
        return new Configuration(Map.of(), Objects.requireNonNull(regex, "regex"), true);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean verboseOutput() {
        return verboseOutput;
    }

    public boolean isInRegexMode() {
        return !regex.isEmpty();
    }

    public Threshold threshold(DeprecationGroup group) {
        return thresholds.get(Objects.requireNonNull(group, "group"));
    }

    /**
     * Looks for the configured pattern anywhere in {@code message}.
     *
     * @throws java.util.regex.PatternSyntaxException when the configured pattern is malformed
     */
    public boolean shouldDisplayStackTrace(String message) {
        if (!isInRegexMode()) {
            return false;
        }
        return compiledRegex().matcher(message).find();
    }

    public boolean tolerates(DeprecationCounts counts) {
        return check(counts).tolerated();
    }

    /**
     * Convenience overload for collectors reporting a string-keyed metric map.
     *
     * @throws IllegalArgumentException when the map breaks the {@link DeprecationCounts#fromMetricMap} contract
     */
    public boolean tolerates(Map<String, ? extends Number> metrics) {
        return tolerates(DeprecationCounts.fromMetricMap(metrics));
    }

    public ToleranceResult check(DeprecationCounts counts) {
        Objects.requireNonNull(counts, "counts");
        if (!enabled) {
            return ToleranceResult.TOLERATED;
        }

        long total = counts.total();
        Threshold totalThreshold = thresholds.get(DeprecationGroup.TOTAL);
        if (totalThreshold.exceededBy(total)) {
            return new ToleranceResult.Exceeded(DeprecationGroup.TOTAL, total, totalThreshold);
        }
        for (DeprecationGroup group : SUB_GROUPS) {
            long remaining = counts.get(DeprecationMetric.remainingFor(group));
            Threshold threshold = thresholds.get(group);
            if (threshold.exceededBy(remaining)) {
                return new ToleranceResult.Exceeded(group, remaining, threshold);
            }
        }
        return ToleranceResult.TOLERATED;
    }

    @Override
    public String toString() {
        return "Configuration{enabled=" + enabled
            + ", thresholds=" + thresholds
            + ", regex='" + regex + '\''
            + ", verboseOutput=" + verboseOutput
            + '}';
    }

    private Pattern compiledRegex() {
        Pattern pattern = compiledRegex;
        if (pattern == null) {
            pattern = DelimitedPattern.compile(regex);
            compiledRegex = pattern;
        }
        return pattern;
    }

    private static long parseThreshold(DeprecationGroup group, String raw) {
        if (raw == null || !NUMERIC.matcher(raw).matches()) {
            throw new InvalidConfigurationException(
                "Threshold for group \"" + group.key() + "\" has invalid value \"" + raw + "\"");
        }
        BigDecimal value = new BigDecimal(raw.trim());
        try {
            return value.setScale(0, RoundingMode.DOWN).longValueExact();
        } catch (ArithmeticException e) {
            throw new InvalidConfigurationException(
                "Threshold for group \"" + group.key() + "\" is out of range: \"" + raw + "\"", e);
        }
    }
}
