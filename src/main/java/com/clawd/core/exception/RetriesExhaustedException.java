package com.clawd.core.exception;

/**
 * Every allowed attempt failed with a retryable error. The last error is the cause.
 */
public class RetriesExhaustedException extends ClawdException {

    private final int attempts;

    public RetriesExhaustedException(int attempts, Throwable lastError) {
        super("Operation failed after " + attempts + " attempt(s): " + lastError.getMessage(), false, lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
