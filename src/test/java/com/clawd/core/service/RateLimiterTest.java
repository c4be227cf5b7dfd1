package com.clawd.core.service;

import com.clawd.core.concurrent.CancellationSignal;
import com.clawd.core.exception.CancelledException;
import com.clawd.core.exception.LimiterUnavailableException;
import com.clawd.core.exception.StoreUnavailableException;
import com.clawd.core.model.BucketSpec;
import com.clawd.core.repository.InMemoryKeyValueStore;
import com.clawd.core.repository.KeyValueStore;
import com.clawd.core.support.MutableClock;
import com.clawd.core.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for RateLimiter.
 */
class RateLimiterTest {

    private MutableClock clock;
    private RateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        rateLimiter = limiterOn(new InMemoryKeyValueStore(1_000, clock));
    }

    private RateLimiter limiterOn(KeyValueStore store) {
        return new RateLimiter(store,
                TestFixtures.registry(
                        new BucketSpec("test_api", 5, 1.0),
                        new BucketSpec("small_api", 3, 1.0),
                        new BucketSpec("garmin_api", 15, 0.25)),
                TestFixtures.objectMapper(),
                TestFixtures.properties(),
                clock);
    }

    @Test
    void testCapacityThenRefill() {
        for (int i = 0; i < 5; i++) {
            assertTrue(rateLimiter.tryAcquire("test_api").block(), "acquire " + (i + 1));
        }
        assertFalse(rateLimiter.tryAcquire("test_api").block());

        clock.advance(Duration.ofSeconds(1));

        assertTrue(rateLimiter.tryAcquire("test_api").block());
        assertFalse(rateLimiter.tryAcquire("test_api").block());
    }

    @Test
    void testRefillIsCappedAtCapacity() {
        assertTrue(rateLimiter.tryAcquire("test_api", 5).block());

        clock.advance(Duration.ofHours(1));

        assertTrue(rateLimiter.tryAcquire("test_api", 5).block());
        assertFalse(rateLimiter.tryAcquire("test_api").block());
    }

    @Test
    void testSlowRefillAccumulatesFractions() {
        assertTrue(rateLimiter.tryAcquire("garmin_api", 15).block());

        clock.advance(Duration.ofSeconds(2));
        assertFalse(rateLimiter.tryAcquire("garmin_api").block());

        clock.advance(Duration.ofSeconds(2));
        assertTrue(rateLimiter.tryAcquire("garmin_api").block());
    }

    @Test
    void testDenialDoesNotConsume() {
        assertTrue(rateLimiter.tryAcquire("test_api", 4).block());
        assertFalse(rateLimiter.tryAcquire("test_api", 2).block());
        assertTrue(rateLimiter.tryAcquire("test_api", 1).block());
    }

    @Test
    void testLaggingClockNeverCreditsRefillTwice() {
        int granted = 0;
        for (int i = 0; i < 4; i++) {
            granted += rateLimiter.tryAcquire("test_api").block() ? 1 : 0;
        }

        // a second process whose clock runs 2s behind takes the last token
        clock.rewind(Duration.ofSeconds(2));
        granted += rateLimiter.tryAcquire("test_api").block() ? 1 : 0;

        // back on the first process, no real time has passed since its last grant
        clock.advance(Duration.ofSeconds(2));
        for (int i = 0; i < 5; i++) {
            granted += rateLimiter.tryAcquire("test_api").block() ? 1 : 0;
        }

        assertEquals(5, granted);

        clock.advance(Duration.ofSeconds(1));
        assertTrue(rateLimiter.tryAcquire("test_api").block());
        assertFalse(rateLimiter.tryAcquire("test_api").block());
    }

    @Test
    void testDenialReportsRetryAfter() {
        StepVerifier.create(rateLimiter.consume("test_api", 5))
                .assertNext(result -> {
                    assertTrue(result.isGranted());
                    assertEquals(0.0, result.getRemainingTokens(), 1e-9);
                    assertEquals(Duration.ZERO, result.getRetryAfter());
                })
                .verifyComplete();

        StepVerifier.create(rateLimiter.consume("test_api", 2))
                .assertNext(result -> {
                    assertFalse(result.isGranted());
                    assertEquals(Duration.ofSeconds(2), result.getRetryAfter());
                })
                .verifyComplete();
    }

    @Test
    void testBucketsAreIndependent() {
        assertTrue(rateLimiter.tryAcquire("test_api", 5).block());
        assertTrue(rateLimiter.tryAcquire("small_api", 3).block());
    }

    @Test
    void testConcurrentAcquirersNeverOverGrant() {
        long granted = Flux.range(0, 20)
                .flatMap(i -> rateLimiter.tryAcquire("test_api").subscribeOn(Schedulers.parallel()))
                .filter(Boolean::booleanValue)
                .count()
                .block();

        assertEquals(5L, granted);
    }

    @Test
    void testAcquireWaitsForRefill() {
        assertTrue(rateLimiter.tryAcquire("small_api", 3).block());

        StepVerifier.create(rateLimiter.acquire("small_api", 1, Duration.ofSeconds(2)))
                .then(() -> clock.advance(Duration.ofSeconds(1)))
                .expectNext(true)
                .verifyComplete();
    }

    @Test
    void testAcquireDeniesWhenWaitExceedsMaxWait() {
        assertTrue(rateLimiter.tryAcquire("small_api", 3).block());

        StepVerifier.create(rateLimiter.acquire("small_api", 3, Duration.ofSeconds(1)))
                .expectNext(false)
                .verifyComplete();
    }

    @Test
    void testCancelledAcquireDoesNotDecrement() {
        assertTrue(rateLimiter.tryAcquire("small_api", 2).block());
        CancellationSignal cancel = CancellationSignal.create();

        StepVerifier.create(rateLimiter.acquire("small_api", 2, Duration.ofSeconds(5), cancel))
                .then(cancel::cancel)
                .expectError(CancelledException.class)
                .verify(Duration.ofSeconds(5));

        clock.advance(Duration.ofSeconds(1));
        assertTrue(rateLimiter.tryAcquire("small_api", 2).block());
    }

    @Test
    void testStoreOutageFailsClosed() {
        KeyValueStore broken = mock(KeyValueStore.class);
        when(broken.get(anyString())).thenReturn(Mono.error(new StoreUnavailableException("down", null)));

        StepVerifier.create(limiterOn(broken).tryAcquire("test_api"))
                .expectError(LimiterUnavailableException.class)
                .verify();
    }

    @Test
    void testRejectsUnknownResourceAndBadTokenCounts() {
        StepVerifier.create(rateLimiter.tryAcquire("nope"))
                .expectError(IllegalArgumentException.class)
                .verify();
        StepVerifier.create(rateLimiter.tryAcquire("test_api", 0))
                .expectError(IllegalArgumentException.class)
                .verify();
        StepVerifier.create(rateLimiter.tryAcquire("test_api", 6))
                .expectError(IllegalArgumentException.class)
                .verify();
    }

    @Test
    void testInspectDoesNotConsume() {
        assertTrue(rateLimiter.tryAcquire("test_api", 2).block());

        StepVerifier.create(rateLimiter.inspect("test_api"))
                .assertNext(snapshot -> {
                    assertEquals(5, snapshot.getCapacity());
                    assertEquals(3.0, snapshot.getAvailableTokens(), 1e-9);
                    assertEquals(0L, snapshot.getWaitMillis());
                })
                .verifyComplete();

        assertTrue(rateLimiter.tryAcquire("test_api", 3).block());
        assertEquals(1000L, rateLimiter.inspect("test_api").block().getWaitMillis());
    }
}
