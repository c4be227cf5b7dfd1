package com.clawd.core.concurrent;

import com.clawd.core.exception.CancelledException;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * External cancellation signal a caller hands to a suspending operation.
 *
 * <p>Once {@link #cancel()} is called, every operation guarded by this signal stops waiting,
 * cancels its in-flight work and fails with {@link CancelledException}. The signal is
 * one-shot and safe to cancel from any thread.</p>
 */
public final class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal(false);

    private final Sinks.Empty<Void> sink;
    private final boolean cancellable;
    private volatile boolean cancelled;

    private CancellationSignal(boolean cancellable) {
        this.cancellable = cancellable;
        this.sink = Sinks.empty();
    }

    /**
     * A fresh signal that has not fired yet.
     */
    public static CancellationSignal create() {
        return new CancellationSignal(true);
    }

    /**
     * A signal that never fires.
     */
    public static CancellationSignal none() {
        return NONE;
    }

    public void cancel() {
        if (!cancellable) {
            throw new IllegalStateException("The shared no-op signal cannot be cancelled");
        }
        cancelled = true;
        sink.tryEmitEmpty();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Race {@code operation} against this signal. If the signal fires first the operation is
     * cancelled (its subscription disposed) and the result fails with {@link CancelledException}.
     *
     * @param operation   work to guard
     * @param description what was cancelled, for the error message
     */
    public <T> Mono<T> guard(Mono<T> operation, String description) {
        if (!cancellable) {
            return operation;
        }
        Mono<T> onCancel = sink.asMono()
                .then(Mono.error(() -> new CancelledException("Cancelled: " + description)));
        return Mono.defer(() -> cancelled
                ? Mono.<T>error(new CancelledException("Cancelled: " + description))
                : Mono.firstWithSignal(operation, onCancel));
    }
}
