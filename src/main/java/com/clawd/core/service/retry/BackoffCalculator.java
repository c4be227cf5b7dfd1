package com.clawd.core.service.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with symmetric jitter.
 *
 * <pre>
 * base(n)  = min(maxDelay, baseDelay * 2^(n-1))
 * delay(n) = base(n) + uniform(-1, 1) * base(n) * jitterFraction, clamped to [0, maxDelay]
 * </pre>
 *
 * <p>Example (baseDelay=500ms, maxDelay=4s, jitter=0.2): n=1 400-600ms, n=2 800-1200ms,
 * n=3 1600-2400ms, n=4 3200-4000ms, n&gt;=5 3200-4000ms.</p>
 */
public class BackoffCalculator {

    private final DoubleSupplier random;

    public BackoffCalculator() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of values in [0, 1)
     */
    public BackoffCalculator(DoubleSupplier random) {
        this.random = random;
    }

    /**
     * Non-jittered delay before retry number {@code attempt} (the attempt that just failed).
     *
     * @param attempt 1-based number of the failed attempt
     */
    public Duration baseDelay(RetryPolicy policy, int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        long baseMillis = policy.getBaseDelay().toMillis();
        long maxMillis = policy.getMaxDelay().toMillis();
        // shift is capped so the multiplication cannot overflow
        int shift = Math.min(attempt - 1, 30);
        long exponential = baseMillis > (maxMillis >> shift) ? maxMillis : baseMillis << shift;
        return Duration.ofMillis(Math.min(exponential, maxMillis));
    }

    /**
     * Jittered delay before the next attempt.
     */
    public Duration delay(RetryPolicy policy, int attempt) {
        long base = baseDelay(policy, attempt).toMillis();
        double offset = (random.getAsDouble() * 2.0 - 1.0) * base * policy.getJitterFraction();
        long jittered = Math.round(base + offset);
        return Duration.ofMillis(Math.max(0L, Math.min(jittered, policy.getMaxDelay().toMillis())));
    }
}
