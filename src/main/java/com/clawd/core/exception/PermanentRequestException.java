package com.clawd.core.exception;

/**
 * Failure that will not go away on retry.
 */
public class PermanentRequestException extends ClawdException {

    public enum Reason {
        /**
         * The request itself is invalid; every provider would reject it.
         */
        MALFORMED_REQUEST,

        /**
         * Credentials for one provider were rejected.
         */
        AUTHENTICATION,

        /**
         * One provider does not know the model or endpoint it was configured with.
         */
        PROVIDER_CONFIGURATION
    }

    private final Reason reason;

    public PermanentRequestException(Reason reason, String message) {
        super(message, false);
        this.reason = reason;
    }

    public PermanentRequestException(Reason reason, String message, Throwable cause) {
        super(message, false, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
