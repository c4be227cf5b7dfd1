package com.clawd.core.controller;

import com.clawd.core.service.CacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Cache invalidation.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final CacheStore cacheStore;

    public CacheController(CacheStore cacheStore) {
        this.cacheStore = cacheStore;
    }

    /**
     * Remove one entry.
     */
    @DeleteMapping("/{namespace}/{key}")
    public Mono<ResponseEntity<Map<String, Object>>> invalidate(@PathVariable String namespace,
                                                                @PathVariable String key) {
        log.info("Cache invalidation requested: {}:{}", namespace, key);

        return cacheStore.invalidate(namespace, key)
                .map(removed -> ResponseEntity.ok(Map.<String, Object>of(
                        "namespace", namespace,
                        "key", key,
                        "removed", removed
                )));
    }

    /**
     * Remove every entry of a namespace.
     */
    @DeleteMapping("/{namespace}")
    public Mono<ResponseEntity<Map<String, Object>>> invalidateNamespace(@PathVariable String namespace) {
        log.info("Cache namespace invalidation requested: {}", namespace);

        return cacheStore.invalidateNamespace(namespace)
                .map(count -> ResponseEntity.ok(Map.<String, Object>of(
                        "namespace", namespace,
                        "removed", count
                )));
    }
}
