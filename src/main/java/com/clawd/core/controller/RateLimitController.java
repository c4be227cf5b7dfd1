package com.clawd.core.controller;

import com.clawd.core.config.RateLimitRegistry;
import com.clawd.core.model.BucketSnapshot;
import com.clawd.core.model.BucketSpec;
import com.clawd.core.service.RateLimiter;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read-only view of the token buckets.
 */
@RestController
@RequestMapping("/v1/rate-limits")
public class RateLimitController {

    private final RateLimiter rateLimiter;
    private final RateLimitRegistry registry;

    public RateLimitController(RateLimiter rateLimiter, RateLimitRegistry registry) {
        this.rateLimiter = rateLimiter;
        this.registry = registry;
    }

    @GetMapping
    public Flux<BucketSnapshot> list() {
        return Flux.fromIterable(registry.all())
                .map(BucketSpec::getResource)
                .concatMap(rateLimiter::inspect);
    }

    @GetMapping("/{resource}")
    public Mono<BucketSnapshot> inspect(@PathVariable String resource) {
        return rateLimiter.inspect(resource);
    }
}
