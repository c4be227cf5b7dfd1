package com.clawd.core.service.retry;

import com.clawd.core.concurrent.CancellationSignal;
import com.clawd.core.exception.RetriesExhaustedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs an operation with bounded, jittered exponential backoff.
 *
 * <p>Attempt 1 starts immediately. After a failure the policy's predicate decides: a
 * non-retryable error propagates as-is on first occurrence; a retryable one is retried after
 * {@link BackoffCalculator#delay} until {@code maxAttempts} is reached, after which the caller
 * gets {@link RetriesExhaustedException} carrying the attempt count and the last error.
 * Attempts never overlap.</p>
 *
 * <p>The operation must be safe to repeat. Wrapping non-idempotent writes is the caller's
 * responsibility (e.g. pass an idempotency key).</p>
 */
@Slf4j
@Service
public class RetryExecutor {

    private final BackoffCalculator backoff;
    private final Scheduler scheduler;

    public RetryExecutor() {
        this(new BackoffCalculator(), Schedulers.parallel());
    }

    public RetryExecutor(BackoffCalculator backoff, Scheduler scheduler) {
        this.backoff = backoff;
        this.scheduler = scheduler;
    }

    public <T> Mono<T> execute(Supplier<Mono<T>> operation, RetryPolicy policy) {
        return execute(operation, policy, CancellationSignal.none());
    }

    /**
     * Execute {@code operation}, re-subscribing to a fresh {@code Mono} on every attempt.
     *
     * @param operation produces one attempt
     * @param policy    attempts, backoff and classification
     * @param cancel    interrupts both a running attempt and a backoff wait
     */
    public <T> Mono<T> execute(Supplier<Mono<T>> operation, RetryPolicy policy, CancellationSignal cancel) {
        Mono<T> attempts = Mono.defer(operation)
                .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                    Throwable failure = signal.failure();
                    int attempt = (int) signal.totalRetries() + 1;

                    if (!policy.getRetryable().test(failure)) {
                        log.debug("Attempt {} failed with non-retryable {}", attempt, failure.toString());
                        return Mono.<Long>error(failure);
                    }
                    if (attempt >= policy.getMaxAttempts()) {
                        log.warn("Giving up after {} attempt(s): {}", attempt, failure.getMessage());
                        return Mono.<Long>error(new RetriesExhaustedException(attempt, failure));
                    }

                    Duration delay = backoff.delay(policy, attempt);
                    log.warn("Attempt {}/{} failed ({}), retrying in {}ms",
                            attempt, policy.getMaxAttempts(), failure.getMessage(), delay.toMillis());
                    return Mono.delay(delay, scheduler);
                })));

        return cancel.guard(attempts, "retrying operation");
    }
}
