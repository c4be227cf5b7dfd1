package com.clawd.core.exception;

/**
 * The rate limiter could not consult its bucket state. The limiter fails closed:
 * callers must treat this as "not granted" unless they explicitly opt into degraded mode.
 */
public class LimiterUnavailableException extends ClawdException {

    private final String resource;

    public LimiterUnavailableException(String resource, Throwable cause) {
        super("Rate limiter unavailable for resource '" + resource + "'", false, cause);
        this.resource = resource;
    }

    public String getResource() {
        return resource;
    }
}
