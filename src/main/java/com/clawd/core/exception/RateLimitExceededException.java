package com.clawd.core.exception;

import java.time.Duration;

/**
 * No token was granted for a quota-limited resource.
 */
public class RateLimitExceededException extends TransientIOException {

    private final String resource;
    private final Duration retryAfter;

    public RateLimitExceededException(String resource, Duration retryAfter) {
        super("Rate limit exceeded for resource '" + resource + "', retry after " + retryAfter.toMillis() + "ms");
        this.resource = resource;
        this.retryAfter = retryAfter;
    }

    public String getResource() {
        return resource;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
