package com.clawd.core.exception;

/**
 * The shared key/value store could not be reached or timed out.
 */
public class StoreUnavailableException extends TransientIOException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
