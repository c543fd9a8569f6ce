package com.funnelcore.analytics.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BreakdownKeyTest {

    @Test
    void encodedFormKeepsSingleEmptyValueDistinctFromNone() {
        BreakdownKey empty = BreakdownKey.of("");

        assertNotEquals(BreakdownKey.none().encode(), empty.encode());
        assertEquals(empty, BreakdownKey.decode(empty.encode()));
        assertTrue(BreakdownKey.decode(BreakdownKey.none().encode()).isNone());
    }

    @Test
    void multiValueKeysDecodeToTheSameValues() {
        BreakdownKey key = BreakdownKey.of("Chrome", "US");
        assertEquals(key, BreakdownKey.decode(key.encode()));
    }

    @Test
    void valuesContainingTheSeparatorOrEscapeSurviveEncoding() {
        BreakdownKey key = BreakdownKey.of("a\u001fb", "C:\\temp\\", "\\\u001f", "");

        BreakdownKey decoded = BreakdownKey.decode(key.encode());

        assertEquals(key, decoded);
        assertEquals(4, decoded.values().size());
        assertEquals("a\u001fb", decoded.values().get(0));
        assertNotEquals(BreakdownKey.of("a", "b").encode(), BreakdownKey.of("a\u001fb").encode());
    }

    @Test
    void rejectsStringsThatWereNotEncodedKeys() {
        assertThrows(IllegalArgumentException.class, () -> BreakdownKey.decode("Chrome"));
    }

    @Test
    void nullValuesBecomeEmptyStrings() {
        assertEquals(BreakdownKey.of("", "x"), BreakdownKey.of(null, "x"));
    }

    @Test
    void ordersLexicographically() {
        assertTrue(BreakdownKey.of("Chrome").compareTo(BreakdownKey.of("Safari")) < 0);
        assertTrue(BreakdownKey.none().compareTo(BreakdownKey.of("")) < 0);
    }
}
