package com.clawd.core.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CacheKeys.
 */
class CacheKeysTest {

    @Test
    void testJoinsParts() {
        assertEquals("user-42:2024-05-01:sleep", CacheKeys.of("user-42", "2024-05-01", "sleep"));
        assertEquals("a::3", CacheKeys.of("a", null, 3));
    }

    @Test
    void testHashesLongKeys() {
        String url = "https://api.github.com/repos/clawd/clawd/issues?state=open&per_page=100&q=" + "x".repeat(200);

        String key = CacheKeys.of("issues", url);

        assertEquals(64, key.length());
        assertEquals(key, CacheKeys.of("issues", url));
    }

    @Test
    void testRequiresParts() {
        assertThrows(IllegalArgumentException.class, CacheKeys::of);
    }
}
