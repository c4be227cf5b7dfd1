package com.clawd.core.exception;

import com.clawd.core.model.ProviderFailure;
import com.clawd.core.model.ProviderTier;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every provider configured for a tier failed. Failures are kept in attempt order.
 */
public class ProvidersExhaustedException extends ClawdException {

    private final ProviderTier tier;
    private final List<ProviderFailure> failures;

    public ProvidersExhaustedException(ProviderTier tier, List<ProviderFailure> failures) {
        super(buildMessage(tier, failures), false);
        this.tier = tier;
        this.failures = List.copyOf(failures);
    }

    public ProviderTier getTier() {
        return tier;
    }

    public List<ProviderFailure> getFailures() {
        return failures;
    }

    private static String buildMessage(ProviderTier tier, List<ProviderFailure> failures) {
        return "All providers failed for tier " + tier + ": " + failures.stream()
                .map(f -> f.getProvider() + "/" + f.getModel() + " (" + f.getKind() + ")")
                .collect(Collectors.joining(", "));
    }
}
