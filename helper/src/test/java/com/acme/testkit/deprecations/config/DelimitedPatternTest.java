package com.acme.testkit.deprecations.config;

import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DelimitedPatternTest {

    @Test
    void shouldStripSlashDelimiters() {
        Pattern pattern = DelimitedPattern.compile("/Foo\\\\Bar/");
        assertEquals("Foo\\\\Bar", pattern.pattern());
        assertTrue(pattern.matcher("Class Foo\\Bar is deprecated").find());
    }

    @Test
    void shouldSupportAlternativeAndBracketDelimiters() {
        assertTrue(DelimitedPattern.compile("#a/b#").matcher("x a/b y").find());
        assertTrue(DelimitedPattern.compile("{fo+}").matcher("foooo").find());
        assertTrue(DelimitedPattern.compile("(^bar$)").matcher("bar").find());
    }

    @Test
    void shouldApplyModifiers() {
        assertTrue(DelimitedPattern.compile("/foo/i").matcher("FOO").find());
        assertTrue(DelimitedPattern.compile("/^b/m").matcher("a\nb").find());
        assertTrue(DelimitedPattern.compile("/a.b/s").matcher("a\nb").find());
        assertFalse(DelimitedPattern.compile("/a.b/").matcher("a\nb").find());
        assertTrue(DelimitedPattern.compile("/a b/x").matcher("ab").find());
    }

    @Test
    void shouldAnchorWithStartModifier() {
        Pattern anchored = DelimitedPattern.compile("/foo|bar/A");
        assertTrue(anchored.matcher("bar baz").find());
        assertFalse(anchored.matcher("x foo").find());
        assertTrue(DelimitedPattern.compile("/fo o # trailing comment/xA").matcher("foo").find());
    }

    @Test
    void shouldIgnoreModifiersWithoutEffect() {
        assertTrue(DelimitedPattern.compile("/foo/S").matcher("a foo").find());
        assertTrue(DelimitedPattern.compile("/foo/X").matcher("a foo").find());
        assertTrue(DelimitedPattern.compile("/foo/J").matcher("a foo").find());
        assertTrue(DelimitedPattern.compile("/foo/ i\n").matcher("A FOO").find());
    }

    @Test
    void shouldRejectModifiersWithoutEquivalent() {
        PatternSyntaxException ungreedy = assertThrows(PatternSyntaxException.class,
            () -> DelimitedPattern.compile("/a+/U"));
        assertTrue(ungreedy.getDescription().contains("'U'"), ungreedy.getDescription());
        assertThrows(PatternSyntaxException.class, () -> DelimitedPattern.compile("/a$/D"));
    }

    @Test
    void shouldRejectInvalidDelimitedPatterns() {
        assertThrows(PatternSyntaxException.class, () -> DelimitedPattern.compile("abc"));
        assertThrows(PatternSyntaxException.class, () -> DelimitedPattern.compile("/abc"));
        assertThrows(PatternSyntaxException.class, () -> DelimitedPattern.compile("/abc/q"));
        assertThrows(PatternSyntaxException.class, () -> DelimitedPattern.compile("\\abc\\"));
    }
}
