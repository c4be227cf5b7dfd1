package com.clawd.core.repository;

import com.clawd.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InMemoryKeyValueStore.
 */
class InMemoryKeyValueStoreTest {

    private MutableClock clock;
    private InMemoryKeyValueStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        store = new InMemoryKeyValueStore(1_000, clock);
    }

    @Test
    void testSetThenGet() {
        store.set("k", bytes("v1"), Duration.ofSeconds(10)).block();

        StepVerifier.create(store.get("k"))
                .assertNext(value -> assertEquals("v1", text(value)))
                .verifyComplete();
    }

    @Test
    void testValueExpiresAfterTtl() {
        store.set("k", bytes("v1"), Duration.ofSeconds(10)).block();

        clock.advance(Duration.ofSeconds(9));
        assertNotNull(store.get("k").block());

        clock.advance(Duration.ofSeconds(1));
        StepVerifier.create(store.get("k")).verifyComplete();
    }

    @Test
    void testCompareAndSetOnAbsentKey() {
        assertTrue(store.compareAndSet("k", null, bytes("first"), Duration.ofSeconds(10)).block());
        // a second "only if absent" write must lose
        assertFalse(store.compareAndSet("k", null, bytes("second"), Duration.ofSeconds(10)).block());

        assertEquals("first", text(store.get("k").block()));
    }

    @Test
    void testCompareAndSetRequiresExactMatch() {
        store.set("k", bytes("v1"), Duration.ofSeconds(10)).block();

        assertFalse(store.compareAndSet("k", bytes("stale"), bytes("v2"), Duration.ofSeconds(10)).block());
        assertTrue(store.compareAndSet("k", bytes("v1"), bytes("v2"), Duration.ofSeconds(10)).block());

        assertEquals("v2", text(store.get("k").block()));
    }

    @Test
    void testExpiredValueCountsAsAbsentForCompareAndSet() {
        store.set("k", bytes("old"), Duration.ofSeconds(1)).block();
        clock.advance(Duration.ofSeconds(2));

        assertTrue(store.compareAndSet("k", null, bytes("new"), Duration.ofSeconds(10)).block());
        assertEquals("new", text(store.get("k").block()));
    }

    @Test
    void testDeleteByPrefix() {
        store.set("ns:a", bytes("1"), Duration.ofMinutes(1)).block();
        store.set("ns:b", bytes("2"), Duration.ofMinutes(1)).block();
        store.set("other:c", bytes("3"), Duration.ofMinutes(1)).block();

        assertEquals(2L, store.deleteByPrefix("ns:").block());
        assertNull(store.get("ns:a").block());
        assertNotNull(store.get("other:c").block());
    }

    @Test
    void testDeleteReportsPresence() {
        store.set("k", bytes("v"), Duration.ofMinutes(1)).block();

        assertTrue(store.delete("k").block());
        assertFalse(store.delete("k").block());
    }

    @Test
    void testStoredBytesAreCopied() {
        byte[] value = bytes("abc");
        store.set("k", value, Duration.ofMinutes(1)).block();
        value[0] = 'x';

        assertEquals("abc", text(store.get("k").block()));
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] value) {
        return new String(value, StandardCharsets.UTF_8);
    }
}
