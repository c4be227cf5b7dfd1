package com.clawd.core.service.retry;

import com.clawd.core.exception.ClawdException;
import com.clawd.core.exception.TransientIOException;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Ready-made classifications for common call sites.
 */
public final class RetryPredicates {

    private RetryPredicates() {
    }

    /**
     * Only {@link TransientIOException} and its subclasses.
     */
    public static Predicate<Throwable> transientOnly() {
        return TransientIOException.class::isInstance;
    }

    /**
     * Core exceptions flagged retryable plus raw I/O errors and timeouts from third-party clients.
     */
    public static Predicate<Throwable> networkErrors() {
        return error -> {
            if (error instanceof ClawdException) {
                return ((ClawdException) error).isRetryable();
            }
            return error instanceof IOException || error instanceof TimeoutException;
        };
    }

    /**
     * Any error whose class is one of {@code types} (or a subclass).
     */
    @SafeVarargs
    public static Predicate<Throwable> anyOf(Class<? extends Throwable>... types) {
        Set<Class<? extends Throwable>> accepted = Set.of(types);
        return error -> accepted.stream().anyMatch(type -> type.isInstance(error));
    }

    public static Predicate<Throwable> never() {
        return error -> false;
    }
}
