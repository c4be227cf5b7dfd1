package com.clawd.core.service.retry;

import com.clawd.core.config.ClawdProperties;
import com.clawd.core.exception.PermanentRequestException;
import com.clawd.core.exception.RateLimitExceededException;
import com.clawd.core.exception.StoreUnavailableException;
import com.clawd.core.exception.TransientIOException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RetryPolicy and RetryPredicates.
 */
class RetryPolicyTest {

    @Test
    void testProviderDefaults() {
        RetryPolicy policy = RetryPolicy.providerDefaults();

        assertEquals(2, policy.getMaxAttempts());
        assertEquals(Duration.ofMillis(500), policy.getBaseDelay());
        assertEquals(Duration.ofSeconds(4), policy.getMaxDelay());
        assertEquals(0.2, policy.getJitterFraction(), 1e-9);
        assertTrue(policy.getRetryable().test(new TransientIOException("timeout")));
        assertFalse(policy.getRetryable().test(new PermanentRequestException(
                PermanentRequestException.Reason.AUTHENTICATION, "bad key")));
    }

    @Test
    void testFromConfig() {
        ClawdProperties.RetryConfig config = new ClawdProperties.RetryConfig();
        config.setMaxAttempts(4);
        config.setBaseDelay(Duration.ofMillis(100));
        config.setMaxDelay(Duration.ofSeconds(1));
        config.setJitter(0.0);

        RetryPolicy policy = RetryPolicy.from(config);

        assertEquals(4, policy.getMaxAttempts());
        assertEquals(Duration.ofMillis(100), policy.getBaseDelay());
        assertEquals(Duration.ofSeconds(1), policy.getMaxDelay());
        assertEquals(0.0, policy.getJitterFraction(), 1e-9);
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().maxAttempts(0).build());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().jitterFraction(1.5).build());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder()
                .baseDelay(Duration.ofSeconds(5))
                .maxDelay(Duration.ofSeconds(1))
                .build());
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.builder().retryable(null).build());
    }

    @Test
    void testNetworkErrorsPredicate() {
        Predicate<Throwable> predicate = RetryPredicates.networkErrors();

        assertTrue(predicate.test(new IOException("reset")));
        assertTrue(predicate.test(new TimeoutException()));
        assertTrue(predicate.test(new StoreUnavailableException("down", null)));
        assertTrue(predicate.test(new RateLimitExceededException("github_api", Duration.ofSeconds(1))));
        assertFalse(predicate.test(new PermanentRequestException(
                PermanentRequestException.Reason.MALFORMED_REQUEST, "bad")));
        assertFalse(predicate.test(new IllegalStateException()));
    }

    @Test
    void testAnyOfAndNever() {
        Predicate<Throwable> predicate = RetryPredicates.anyOf(IOException.class, TimeoutException.class);

        assertTrue(predicate.test(new IOException("reset")));
        assertTrue(predicate.test(new TimeoutException()));
        assertFalse(predicate.test(new IllegalStateException()));
        assertFalse(RetryPredicates.never().test(new TransientIOException("x")));
    }
}
