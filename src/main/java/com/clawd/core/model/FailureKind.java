package com.clawd.core.model;

/**
 * Why a provider attempt was abandoned.
 */
public enum FailureKind {
    TRANSIENT,
    RETRIES_EXHAUSTED,
    RATE_LIMITED,
    LIMITER_UNAVAILABLE,
    AUTHENTICATION,
    PROVIDER_CONFIGURATION,
    UNSUPPORTED_CAPABILITY,
    MALFORMED_REQUEST,
    UNEXPECTED
}
