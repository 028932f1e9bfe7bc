package com.acme.testkit.deprecations.config;

/**
 * Thrown while building a {@link Configuration} from malformed settings: an unknown option or
 * threshold group, a non-numeric threshold, or an option with the wrong shape.
 */
public final class InvalidConfigurationException extends IllegalArgumentException {
    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
