package com.acme.testkit.deprecations.config;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Query-string options such as {@code max[total]=1234&max[indirect]=42&verbose=0}.
 *
 * <p>Keys and values are URL-decoded. A key may carry one bracketed sub-key, which groups it into
 * a nested map. An empty sub-key ({@code max[]}) takes the next integer index. A key without {@code =} has an
 * empty value. Later pairs replace earlier ones.</p>
 */
final class UrlEncodedOptions {
    private final Map<String, Option> options;

    private UrlEncodedOptions(Map<String, Option> options) {
        this.options = Collections.unmodifiableMap(options);
    }

    static UrlEncodedOptions parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        Map<String, Option> options = new LinkedHashMap<>();
        for (String pair : raw.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = decode(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
            if (key.isEmpty()) {
                continue;
            }
            put(options, key, value);
        }
        return new UrlEncodedOptions(options);
    }

    Set<String> keys() {
        return options.keySet();
    }

    boolean has(String key) {
        return options.containsKey(key);
    }

    /**
     * @return the scalar value of {@code key}, or {@code null} when absent
     * @throws InvalidConfigurationException when {@code key} holds a nested map
     */
    String scalar(String key) {
        Option option = options.get(key);
        if (option == null) {
            return null;
        }
        if (option.nested() != null) {
            throw new InvalidConfigurationException("Option \"" + key + "\" expects a single value");
        }
        return option.scalar();
    }

    /**
     * @return the nested map of {@code key}, empty when absent
     * @throws InvalidConfigurationException when {@code key} holds a scalar
     */
    Map<String, String> nested(String key) {
        Option option = options.get(key);
        if (option == null) {
            return Map.of();
        }
        if (option.nested() == null) {
            throw new InvalidConfigurationException("Option \"" + key + "\" expects bracketed entries, e.g. "
                + key + "[total]=0");
        }
        return Collections.unmodifiableMap(option.nested());
    }

    private static void put(Map<String, Option> options, String key, String value) {
        int open = key.indexOf('[');
        int close = open < 0 ? -1 : key.indexOf(']', open);
        if (open <= 0 || close < 0) {
            options.put(key, new Option(value, null));
            return;
        }
        String name = key.substring(0, open);
        String subKey = key.substring(open + 1, close);
        if (close + 1 < key.length() && key.charAt(close + 1) == '[') {
            throw new InvalidConfigurationException("Option \"" + key + "\" is nested too deeply");
        }

        Option existing = options.get(name);
        Map<String, String> nested = existing != null && existing.nested() != null
            ? existing.nested()
            : new LinkedHashMap<>();
        if (subKey.isEmpty()) {
            subKey = Long.toString(nextIndex(nested));
        }
        nested.put(subKey, value);
        options.put(name, new Option(null, nested));
    }

    /**
     * One past the highest non-negative integer key, or 0 when there is none.
     */
    private static long nextIndex(Map<String, String> nested) {
        long next = 0;
        for (String key : nested.keySet()) {
            if (isCanonicalIndex(key)) {
                try {
                    next = Math.max(next, Long.parseLong(key) + 1);
                } catch (NumberFormatException e) {
                    throw new InvalidConfigurationException("Option index out of range: \"" + key + "\"", e);
                }
            }
        }
        return next;
    }

    private static boolean isCanonicalIndex(String key) {
        if (key.equals("0")) {
            return true;
        }
        if (key.isEmpty() || key.charAt(0) < '1' || key.charAt(0) > '9') {
            return false;
        }
        for (int i = 1; i < key.length(); i++) {
            if (key.charAt(i) < '0' || key.charAt(i) > '9') {
                return false;
            }
        }
        return true;
    }

    private static String decode(String raw) {
        try {
            return URLDecoder.decode(raw, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Malformed URL encoding in \"" + raw + "\"", e);
        }
    }

    private record Option(String scalar, Map<String, String> nested) {}
}
