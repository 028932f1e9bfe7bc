package com.acme.testkit.deprecations.config;

import com.acme.testkit.deprecations.util.EnvVars;
import com.acme.testkit.deprecations.util.HelperEnvKeys;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Picks a {@link Configuration} from a single mode string, normally the
 * {@value HelperEnvKeys#DEPRECATIONS_HELPER} environment variable.
 *
 * <ul>
 *   <li>{@code strict}, {@code weak}, {@code disabled}: the matching preset</li>
 *   <li>a pattern starting with {@code /}: regex mode</li>
 *   <li>a positive integer: total threshold</li>
 *   <li>unset, blank or {@code 0}: zero tolerance</li>
 *   <li>anything else: URL-encoded settings</li>
 * </ul>
 */
public final class ConfigurationResolver {
    private static final Logger LOG = Logger.getLogger(ConfigurationResolver.class.getName());

    public static final String MODE_STRICT = "strict";
    public static final String MODE_WEAK = "weak";
    public static final String MODE_DISABLED = "disabled";

    private ConfigurationResolver() {
    }

    public static Configuration fromEnvironment() {
        return resolve(System.getenv());
    }

    public static Configuration resolve(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return resolve(EnvVars.getTrimmedOrNull(env, HelperEnvKeys.DEPRECATIONS_HELPER));
    }

    /**
     * @param mode mode string, may be {@code null}
     * @throws InvalidConfigurationException when the mode falls through to URL-encoded settings that are malformed
     */
    public static Configuration resolve(String mode) {
        Configuration configuration = select(mode);
        LOG.fine(() -> "Deprecation mode \"" + mode + "\" resolved to " + configuration);
        return configuration;
    }

    private static Configuration select(String mode) {
        if (mode == null || mode.isEmpty() || mode.equals("0")) {
            return Configuration.fromNumber(0);
        }
        return switch (mode) {
            case MODE_STRICT -> Configuration.inStrictMode();
            case MODE_DISABLED -> Configuration.inDisabledMode();
            case MODE_WEAK -> Configuration.inWeakMode();
            default -> selectByShape(mode);
        };
    }

    private static Configuration selectByShape(String mode) {
        if (mode.charAt(0) == '/') {
            return Configuration.fromRegex(mode);
        }
        if (isPositiveInteger(mode)) {
            try {
                return Configuration.fromNumber(Long.parseLong(mode));
            } catch (NumberFormatException e) {
                throw new InvalidConfigurationException("Deprecation threshold is out of range: \"" + mode + "\"", e);
            }
        }
        return Configuration.fromUrlEncodedString(mode);
    }

    private static boolean isPositiveInteger(String mode) {
        if (mode.charAt(0) < '1' || mode.charAt(0) > '9') {
            return false;
        }
        for (int i = 1; i < mode.length(); i++) {
            char c = mode.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
