package com.clawd.core.service;

import com.clawd.core.exception.StoreUnavailableException;
import com.clawd.core.repository.InMemoryKeyValueStore;
import com.clawd.core.repository.KeyValueStore;
import com.clawd.core.support.MutableClock;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for StoreHealthService.
 */
class StoreHealthServiceTest {

    private final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");

    @Test
    void testHealthyStore() {
        StoreHealthService service = new StoreHealthService(new InMemoryKeyValueStore(10, clock), clock);

        StepVerifier.create(service.check())
                .assertNext(health -> {
                    assertTrue(health.isHealthy());
                    assertEquals("memory", health.getStore());
                    assertNull(health.getError());
                })
                .verifyComplete();
    }

    @Test
    void testUnreachableStoreIsReportedNotThrown() {
        KeyValueStore broken = mock(KeyValueStore.class);
        when(broken.getType()).thenReturn("redis");
        when(broken.ping()).thenReturn(Mono.error(new StoreUnavailableException("Redis command failed: PING", null)));

        StepVerifier.create(new StoreHealthService(broken, clock).check())
                .assertNext(health -> {
                    assertFalse(health.isHealthy());
                    assertEquals("redis", health.getStore());
                    assertEquals("Redis command failed: PING", health.getError());
                })
                .verifyComplete();
    }
}
