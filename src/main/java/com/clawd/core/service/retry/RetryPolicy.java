package com.clawd.core.service.retry;

import com.clawd.core.config.ClawdProperties;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Immutable retry policy for one call site. Which errors are transient is decided here, by the
 * caller, never by the executor.
 */
@Value
public class RetryPolicy {

    int maxAttempts;
    Duration baseDelay;
    Duration maxDelay;
    double jitterFraction;
    Predicate<Throwable> retryable;

    @Builder(toBuilder = true)
    private RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitterFraction,
                        Predicate<Throwable> retryable) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 (current: " + maxAttempts + ")");
        }
        if (baseDelay == null || baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative (current: " + baseDelay + ")");
        }
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException(
                    "maxDelay must be >= baseDelay (base: " + baseDelay + ", max: " + maxDelay + ")");
        }
        if (jitterFraction < 0.0 || jitterFraction > 1.0) {
            throw new IllegalArgumentException(
                    "jitterFraction must be between 0.0 and 1.0 (current: " + jitterFraction + ")");
        }
        if (retryable == null) {
            throw new IllegalArgumentException("retryable predicate is required");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitterFraction = jitterFraction;
        this.retryable = retryable;
    }

    /**
     * Policy for one provider attempt: 2 attempts, 500ms base, 4s cap, 20% jitter, transient
     * errors only.
     */
    public static RetryPolicy providerDefaults() {
        return RetryPolicy.builder().build();
    }

    /**
     * Policy from a provider's retry configuration, retrying transient errors only.
     */
    public static RetryPolicy from(ClawdProperties.RetryConfig config) {
        return RetryPolicy.builder()
                .maxAttempts(config.getMaxAttempts())
                .baseDelay(config.getBaseDelay())
                .maxDelay(config.getMaxDelay())
                .jitterFraction(config.getJitter())
                .build();
    }

    public static class RetryPolicyBuilder {
        private int maxAttempts = 2;
        private Duration baseDelay = Duration.ofMillis(500);
        private Duration maxDelay = Duration.ofSeconds(4);
        private double jitterFraction = 0.2;
        private Predicate<Throwable> retryable = RetryPredicates.transientOnly();
    }
}
