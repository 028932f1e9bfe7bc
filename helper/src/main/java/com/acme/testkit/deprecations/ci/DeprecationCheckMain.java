package com.acme.testkit.deprecations.ci;

import com.acme.testkit.deprecations.config.Configuration;
import com.acme.testkit.deprecations.config.ConfigurationResolver;
import com.acme.testkit.deprecations.config.ToleranceResult;
import com.acme.testkit.deprecations.count.DeprecationCounts;
import com.acme.testkit.deprecations.util.EnvVars;
import com.acme.testkit.deprecations.util.HelperEnvKeys;
import com.acme.testkit.deprecations.util.JsonCodec;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Fails a CI build when the deprecation counts of a test run are not tolerated.
 *
 * <p>Usage: {@code DeprecationCheckMain [counts.json] [mode]}. The counts file holds the collector's
 * metric map; the mode defaults to {@value HelperEnvKeys#DEPRECATIONS_HELPER}.</p>
 */
public final class DeprecationCheckMain {
    private static final Logger LOG = Logger.getLogger(DeprecationCheckMain.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_NOT_TOLERATED = 2;

    private DeprecationCheckMain() {
    }

    public static void main(String[] args) throws Exception {
        int exitCode = run(args, System.getenv(), System.out);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args, Map<String, String> env, PrintStream out) throws Exception {
        Path input = args.length > 0
            ? Path.of(args[0])
            : Path.of(EnvVars.getOrDefault(env, HelperEnvKeys.DEPRECATIONS_COUNTS_FILE, HelperEnvKeys.DEFAULT_COUNTS_FILE));
        if (!Files.exists(input)) {
            throw new IllegalArgumentException("deprecation counts file not found: " + input);
        }
        DeprecationCounts counts = DeprecationCounts.fromMetricMap(JsonCodec.readMetrics(Files.readString(input)));
        Configuration configuration = args.length > 1
            ? ConfigurationResolver.resolve(args[1])
            : ConfigurationResolver.resolve(env);

        ToleranceResult result = configuration.check(counts);
        out.println("deprecationResult=" + result + " total=" + counts.total() + " configuration=" + configuration);
        if (result instanceof ToleranceResult.Exceeded exceeded) {
            LOG.warning(() -> "Deprecation threshold exceeded: " + exceeded.reason()
                + " count=" + exceeded.count() + " threshold=" + exceeded.threshold());
            return EXIT_NOT_TOLERATED;
        }
        return EXIT_OK;
    }
}
