package com.clawd.core.config;

import com.clawd.core.model.BucketSpec;
import com.clawd.core.model.ProviderTarget;
import com.clawd.core.model.ProviderTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the startup-loaded, read-only tables the resilience services work from.
 */
@Slf4j
@Configuration
public class ResilienceConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimitRegistry rateLimitRegistry(ClawdProperties properties) {
        List<BucketSpec> specs = properties.getRateLimits().entrySet().stream()
                .map(e -> new BucketSpec(e.getKey(), e.getValue().getCapacity(), e.getValue().getRefillRate()))
                .toList();

        for (Map.Entry<String, ClawdProperties.ProviderConfig> provider : properties.getProviders().entrySet()) {
            String resource = provider.getValue().getRateLimitResource();
            if (resource != null && properties.getRateLimits().get(resource) == null) {
                throw new IllegalStateException("Provider '" + provider.getKey()
                        + "' references unknown rate limit resource '" + resource + "'");
            }
        }

        log.info("Loaded rate limits for {} resources: {}", specs.size(),
                specs.stream().map(BucketSpec::getResource).toList());
        return new RateLimitRegistry(specs);
    }

    @Bean
    public TierRoutingTable tierRoutingTable(ClawdProperties properties) {
        Map<ProviderTier, List<ProviderTarget>> routes = new EnumMap<>(ProviderTier.class);

        properties.getTiers().forEach((name, targets) -> {
            ProviderTier tier = ProviderTier.fromAlias(name);
            for (ProviderTarget target : targets) {
                if (!properties.getProviders().containsKey(target.getProvider())) {
                    throw new IllegalStateException("Tier '" + name + "' references unknown provider '"
                            + target.getProvider() + "'");
                }
                if (target.getModel() == null || target.getModel().isBlank()) {
                    throw new IllegalStateException("Tier '" + name + "' has a target without a model");
                }
            }
            routes.put(tier, targets);
        });

        TierRoutingTable table = new TierRoutingTable(routes);
        table.asMap().forEach((tier, targets) -> log.info("Tier {} -> {}", tier, targets));
        return table;
    }
}
