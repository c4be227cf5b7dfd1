package com.clawd.core.model;

import lombok.Value;

import java.time.Duration;

/**
 * Outcome of one token bucket admission check.
 */
@Value
public class AcquireResult {

    boolean granted;

    /**
     * Tokens left after the check.
     */
    double remainingTokens;

    /**
     * Time until the requested tokens would be available; zero when granted.
     */
    Duration retryAfter;

    public static AcquireResult granted(double remainingTokens) {
        return new AcquireResult(true, remainingTokens, Duration.ZERO);
    }

    public static AcquireResult denied(double remainingTokens, Duration retryAfter) {
        return new AcquireResult(false, remainingTokens, retryAfter);
    }
}
