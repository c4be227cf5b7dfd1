package com.clawd.core.exception;

/**
 * Network-level failure expected to succeed on retry: timeouts, connection resets,
 * HTTP 429 and 5xx responses.
 */
public class TransientIOException extends ClawdException {

    public TransientIOException(String message) {
        super(message, true);
    }

    public TransientIOException(String message, Throwable cause) {
        super(message, true, cause);
    }
}
