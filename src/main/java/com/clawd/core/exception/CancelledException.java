package com.clawd.core.exception;

/**
 * The caller's cancellation signal fired before the operation finished.
 */
public class CancelledException extends ClawdException {

    public CancelledException(String message) {
        super(message, false);
    }
}
