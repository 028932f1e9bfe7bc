package com.acme.testkit.deprecations.config;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles delimited patterns of the form {@code /body/flags} into {@link Pattern}s.
 *
 * <p>Any non-alphanumeric, non-backslash, non-whitespace character may delimit the body. The
 * bracket pairs {@code () [] {} <>} close with their counterpart. Supported modifiers are
 * {@code i m s x u} and {@code A}, which anchors the match at the start of the subject. {@code S X J}
 * and whitespace are accepted and ignored. {@code D} and {@code U} are rejected.</p>
 */
final class DelimitedPattern {
    private DelimitedPattern() {
    }

    static Pattern compile(String delimited) {
        if (delimited.isEmpty()) {
            throw new PatternSyntaxException("Empty pattern", delimited, 0);
        }
        char open = delimited.charAt(0);
        if (Character.isLetterOrDigit(open) || open == '\\' || Character.isWhitespace(open)) {
            throw new PatternSyntaxException("Delimiter must not be alphanumeric, backslash or whitespace", delimited, 0);
        }
        char close = closingDelimiter(open);
        int end = delimited.lastIndexOf(close);
        if (end <= 0) {
            throw new PatternSyntaxException("No ending delimiter '" + close + "' found", delimited, delimited.length());
        }

        int flags = 0;
        boolean anchored = false;
        for (int i = end + 1; i < delimited.length(); i++) {
            char modifier = delimited.charAt(i);
            switch (modifier) {
                case 'i' -> flags |= Pattern.CASE_INSENSITIVE;
                case 'm' -> flags |= Pattern.MULTILINE;
                case 's' -> flags |= Pattern.DOTALL;
                case 'x' -> flags |= Pattern.COMMENTS;
                case 'u' -> flags |= Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;
                case 'A' -> anchored = true;
                // no-ops here; duplicate group names still fail in Pattern.compile
                case 'S', 'X', 'J', ' ', '\n', '\r', '\t' -> {
                }
                case 'D', 'U' -> throw new PatternSyntaxException(
                    "Modifier '" + modifier + "' has no java.util.regex equivalent", delimited, i);
                default -> throw new PatternSyntaxException("Unknown modifier '" + modifier + "'", delimited, i);
            }
        }
        String body = delimited.substring(1, end);
        if (anchored) {
            body = "\\G(?:" + body + ((flags & Pattern.COMMENTS) != 0 ? "\n)" : ")");
        }
        return Pattern.compile(body, flags);
    }

    private static char closingDelimiter(char open) {
        return switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            case '{' -> '}';
            case '<' -> '>';
            default -> open;
        };
    }
}
