package com.clawd.core.config;

import com.clawd.core.model.ProviderTarget;
import com.clawd.core.model.ProviderTier;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable tier to ordered-provider mapping, built once at startup. Primary target first.
 */
public final class TierRoutingTable {

    private final Map<ProviderTier, List<ProviderTarget>> routes;

    public TierRoutingTable(Map<ProviderTier, List<ProviderTarget>> routes) {
        EnumMap<ProviderTier, List<ProviderTarget>> copy = new EnumMap<>(ProviderTier.class);
        routes.forEach((tier, targets) -> copy.put(tier, targets.stream()
                .map(t -> new ProviderTarget(t.getProvider(), t.getModel()))
                .toList()));
        this.routes = Collections.unmodifiableMap(copy);
    }

    /**
     * @return the ordered targets for {@code tier}; empty if the tier has none configured
     */
    public List<ProviderTarget> targets(ProviderTier tier) {
        List<ProviderTarget> targets = routes.get(tier);
        if (targets == null) {
            return List.of();
        }
        // hand out copies so the table itself stays read-only
        return targets.stream()
                .map(t -> new ProviderTarget(t.getProvider(), t.getModel()))
                .toList();
    }

    public Map<ProviderTier, List<ProviderTarget>> asMap() {
        return routes;
    }
}
