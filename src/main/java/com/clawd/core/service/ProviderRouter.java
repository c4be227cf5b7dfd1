package com.clawd.core.service;

import com.clawd.core.concurrent.CancellationSignal;
import com.clawd.core.config.ClawdProperties;
import com.clawd.core.config.TierRoutingTable;
import com.clawd.core.exception.CancelledException;
import com.clawd.core.exception.LimiterUnavailableException;
import com.clawd.core.exception.PermanentRequestException;
import com.clawd.core.exception.ProvidersExhaustedException;
import com.clawd.core.exception.RateLimitExceededException;
import com.clawd.core.exception.RetriesExhaustedException;
import com.clawd.core.exception.TransientIOException;
import com.clawd.core.exception.UnsupportedCapabilityException;
import com.clawd.core.model.CompletionRequest;
import com.clawd.core.model.CompletionResponse;
import com.clawd.core.model.FailureKind;
import com.clawd.core.model.ProviderFailure;
import com.clawd.core.model.ProviderTarget;
import com.clawd.core.model.ProviderTier;
import com.clawd.core.provider.ProviderAdapter;
import com.clawd.core.service.retry.RetryExecutor;
import com.clawd.core.service.retry.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes completions to the providers of a tier with ordered failover.
 *
 * <p>Providers are tried strictly in configured order, one at a time. Before each attempt one
 * token is taken from the provider's rate limit resource; a denial moves on to the next
 * provider. Each attempt runs under the provider's {@link RetryPolicy}, so a single transient
 * error is absorbed before failing over. A malformed request stops the walk, since no other
 * provider would accept it either. When every provider has failed the caller gets
 * {@link ProvidersExhaustedException} with the per-provider failures in order.</p>
 */
@Slf4j
@Service
public class ProviderRouter {

    private final Map<String, ProviderAdapter> adapters;
    private final TierRoutingTable routingTable;
    private final RateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final ClawdProperties properties;

    public ProviderRouter(List<ProviderAdapter> adapters,
                          TierRoutingTable routingTable,
                          RateLimiter rateLimiter,
                          RetryExecutor retryExecutor,
                          ClawdProperties properties) {
        this.adapters = new LinkedHashMap<>();
        for (ProviderAdapter adapter : adapters) {
            this.adapters.put(adapter.getName(), adapter);
        }
        this.routingTable = routingTable;
        this.rateLimiter = rateLimiter;
        this.retryExecutor = retryExecutor;
        this.properties = properties;

        log.info("Initialized ProviderRouter with {} providers: {}", this.adapters.size(), this.adapters.keySet());
    }

    public Mono<CompletionResponse> complete(CompletionRequest request, ProviderTier tier) {
        return complete(request, tier, CancellationSignal.none());
    }

    /**
     * Complete {@code request} with the first provider of {@code tier} that succeeds.
     *
     * @return the response, with {@code failoverHistory} listing the providers skipped before it
     */
    public Mono<CompletionResponse> complete(CompletionRequest request, ProviderTier tier, CancellationSignal cancel) {
        if (request == null || request.getMessages() == null || request.getMessages().isEmpty()) {
            return Mono.error(new PermanentRequestException(PermanentRequestException.Reason.MALFORMED_REQUEST,
                    "Completion request needs at least one message"));
        }

        List<ProviderTarget> targets = routingTable.targets(tier);
        log.debug("Routing {} request over {}", tier, targets);

        Mono<CompletionResponse> routed = Mono.defer(() ->
                attempt(request, tier, targets, 0, new ArrayList<>(), cancel));
        return cancel.guard(routed, "completion on tier " + tier);
    }

    /**
     * Pre-flight token estimate for {@code request}; see {@link TokenEstimator}.
     */
    public int estimateTokens(CompletionRequest request) {
        return TokenEstimator.estimate(request);
    }

    private Mono<CompletionResponse> attempt(CompletionRequest request,
                                             ProviderTier tier,
                                             List<ProviderTarget> targets,
                                             int index,
                                             List<ProviderFailure> failures,
                                             CancellationSignal cancel) {
        if (index >= targets.size()) {
            log.error("All {} provider(s) failed for tier {}", failures.size(), tier);
            return Mono.error(new ProvidersExhaustedException(tier, failures));
        }

        ProviderTarget target = targets.get(index);
        return attemptProvider(request, target, cancel)
                .map(response -> {
                    response.setFailoverHistory(List.copyOf(failures));
                    if (!failures.isEmpty()) {
                        log.info("Tier {} served by {} after {} failover(s)", tier, target, failures.size());
                    }
                    return response;
                })
                .onErrorResume(error -> !(error instanceof CancelledException), error -> {
                    ProviderFailure failure = toFailure(target, error);

                    if (failure.getKind() == FailureKind.MALFORMED_REQUEST) {
                        log.warn("Provider {} rejected the request as malformed, not failing over: {}",
                                target, error.getMessage());
                        for (ProviderFailure earlier : failures) {
                            error.addSuppressed(earlier.getError());
                        }
                        return Mono.error(error);
                    }

                    failures.add(failure);
                    log.warn("Provider {} failed ({}): {}", target, failure.getKind(), failure.getMessage());
                    return attempt(request, tier, targets, index + 1, failures, cancel);
                });
    }

    private Mono<CompletionResponse> attemptProvider(CompletionRequest request,
                                                     ProviderTarget target,
                                                     CancellationSignal cancel) {
        ProviderAdapter adapter = adapters.get(target.getProvider());
        if (adapter == null || !adapter.isEnabled()) {
            return Mono.error(new PermanentRequestException(PermanentRequestException.Reason.PROVIDER_CONFIGURATION,
                    "Provider " + target.getProvider() + " is not available"));
        }

        ClawdProperties.ProviderConfig config = properties.getProviders()
                .getOrDefault(target.getProvider(), new ClawdProperties.ProviderConfig());
        String resource = config.getRateLimitResource();
        RetryPolicy policy = RetryPolicy.from(config.getRetry());

        Mono<Boolean> permit = resource == null
                ? Mono.just(Boolean.TRUE)
                : rateLimiter.acquire(resource, 1, config.getRateLimitWait(), cancel);

        return permit.flatMap(granted -> {
            if (!granted) {
                return Mono.error(new RateLimitExceededException(resource, config.getRateLimitWait()));
            }
            log.info("Attempting provider {}", target);
            return retryExecutor.execute(() -> adapter.complete(request, target.getModel()), policy, cancel);
        });
    }

    private static ProviderFailure toFailure(ProviderTarget target, Throwable error) {
        ProviderFailure.ProviderFailureBuilder failure = ProviderFailure.builder()
                .provider(target.getProvider())
                .model(target.getModel())
                .message(error.getMessage())
                .error(error);

        if (error instanceof RetriesExhaustedException) {
            RetriesExhaustedException exhausted = (RetriesExhaustedException) error;
            failure.kind(FailureKind.RETRIES_EXHAUSTED).attempts(exhausted.getAttempts());
            if (exhausted.getCause() != null) {
                failure.message(exhausted.getCause().getMessage());
            }
        } else if (error instanceof RateLimitExceededException) {
            failure.kind(FailureKind.RATE_LIMITED);
        } else if (error instanceof TransientIOException) {
            failure.kind(FailureKind.TRANSIENT);
        } else if (error instanceof LimiterUnavailableException) {
            failure.kind(FailureKind.LIMITER_UNAVAILABLE);
        } else if (error instanceof UnsupportedCapabilityException) {
            failure.kind(FailureKind.UNSUPPORTED_CAPABILITY);
        } else if (error instanceof PermanentRequestException) {
            failure.kind(switch (((PermanentRequestException) error).getReason()) {
                case MALFORMED_REQUEST -> FailureKind.MALFORMED_REQUEST;
                case AUTHENTICATION -> FailureKind.AUTHENTICATION;
                case PROVIDER_CONFIGURATION -> FailureKind.PROVIDER_CONFIGURATION;
            });
        } else {
            failure.kind(FailureKind.UNEXPECTED);
        }
        return failure.build();
    }
}
