package com.clawd.core.exception;

/**
 * Base class for every failure surfaced by the core.
 *
 * The {@code retryable} flag is advisory: retry predicates may consult it, but the
 * retry executor never does so on its own.
 */
public class ClawdException extends RuntimeException {

    private final boolean retryable;

    public ClawdException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public ClawdException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
