package com.acme.testkit.deprecations.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UrlEncodedOptionsTest {

    @Test
    void shouldGroupBracketedKeysIntoNestedMap() {
        UrlEncodedOptions options = UrlEncodedOptions.parse("max[total]=1234&max[indirect]=42&verbose=0");
        assertEquals(List.of("max", "verbose"), List.copyOf(options.keys()));
        assertEquals(Map.of("total", "1234", "indirect", "42"), options.nested("max"));
        assertEquals("0", options.scalar("verbose"));
    }

    @Test
    void shouldTreatKeyWithoutValueAsEmpty() {
        UrlEncodedOptions options = UrlEncodedOptions.parse("disabled&&verbose=");
        assertTrue(options.has("disabled"));
        assertEquals("", options.scalar("disabled"));
        assertEquals("", options.scalar("verbose"));
    }

    @Test
    void shouldLetLaterPairsWin() {
        UrlEncodedOptions options = UrlEncodedOptions.parse("max[total]=1&max[total]=2&verbose=1&verbose=0");
        assertEquals(Map.of("total", "2"), options.nested("max"));
        assertEquals("0", options.scalar("verbose"));

        UrlEncodedOptions replaced = UrlEncodedOptions.parse("max=1&max[self]=3");
        assertEquals(Map.of("self", "3"), replaced.nested("max"));
    }

    @Test
    void shouldDecodeKeysAndValues() {
        UrlEncodedOptions options = UrlEncodedOptions.parse("max%5Bself%5D=%2B4&x+y=a%20b");
        assertEquals(Map.of("self", "+4"), options.nested("max"));
        assertEquals("a b", options.scalar("x y"));
    }

    @Test
    void shouldNumberEmptyBrackets() {
        UrlEncodedOptions options = UrlEncodedOptions.parse("max[]=1&max[]=2");
        assertEquals(Map.of("0", "1", "1", "2"), options.nested("max"));
    }

    @Test
    void shouldContinueAfterHighestIntegerIndex() {
        UrlEncodedOptions options = UrlEncodedOptions.parse("max[1]=a&max[]=b");
        assertEquals(Map.of("1", "a", "2", "b"), options.nested("max"));

        UrlEncodedOptions named = UrlEncodedOptions.parse("max[total]=1&max[07]=x&max[]=2");
        assertEquals(Map.of("total", "1", "07", "x", "0", "2"), named.nested("max"));
    }

    @Test
    void shouldReportAbsentOptions() {
        UrlEncodedOptions options = UrlEncodedOptions.parse("");
        assertFalse(options.has("max"));
        assertNull(options.scalar("verbose"));
        assertTrue(options.nested("max").isEmpty());
    }

    @Test
    void shouldRejectMalformedInput() {
        assertThrows(InvalidConfigurationException.class, () -> UrlEncodedOptions.parse("max[total]=%zz"));
        assertThrows(InvalidConfigurationException.class, () -> UrlEncodedOptions.parse("max[a][b]=1"));
        assertThrows(InvalidConfigurationException.class, () -> UrlEncodedOptions.parse("max=1").nested("max"));
        assertThrows(InvalidConfigurationException.class, () -> UrlEncodedOptions.parse("verbose[a]=1").scalar("verbose"));
    }
}
