package com.modsearch.common.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextUtilsTest {

    @Test
    void testTruncateLongText() {
        assertEquals("abcd…", TextUtils.truncate("abcdefgh", 5));
    }

    @Test
    void testTruncatePadsShortText() {
        assertEquals("ab   ", TextUtils.truncate("ab", 5));
        assertEquals("ab", TextUtils.truncate("ab", 5, false));
    }

    @Test
    void testCapitalize() {
        assertEquals("Fabric", TextUtils.capitalize("fabric"));
        assertEquals("", TextUtils.capitalize(""));
    }
}
