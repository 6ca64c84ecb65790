package com.mailflow.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Watermarks")
class WatermarksTest {

    private static final long ABOVE_SIGNED_MAX = Long.parseUnsignedLong("18446744073709551000");

    @Test
    @DisplayName("Should compare history ids as unsigned values")
    void shouldCompareUnsigned() {
        assertTrue(Watermarks.isAfter(ABOVE_SIGNED_MAX, Long.MAX_VALUE));
        assertEquals(ABOVE_SIGNED_MAX, Watermarks.max(5L, ABOVE_SIGNED_MAX));
        assertEquals("18446744073709551000", Watermarks.format(ABOVE_SIGNED_MAX));
        assertEquals(ABOVE_SIGNED_MAX, Watermarks.parse(" 18446744073709551000 "));
    }

    @Test
    @DisplayName("Window is exclusive below and inclusive above")
    void windowBounds() {
        assertFalse(Watermarks.inWindow(100, 100, 150L));
        assertTrue(Watermarks.inWindow(101, 100, 150L));
        assertTrue(Watermarks.inWindow(150, 100, 150L));
        assertFalse(Watermarks.inWindow(151, 100, 150L));
        assertTrue(Watermarks.inWindow(10_000, 100, null));
    }
}
