package com.clawd.core.service;

import com.clawd.core.model.StoreHealth;
import com.clawd.core.repository.KeyValueStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Probes the shared backing store.
 */
@Slf4j
@Service
public class StoreHealthService {

    private final KeyValueStore store;
    private final Clock clock;

    public StoreHealthService(KeyValueStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Ping the store. Never fails; an unreachable store is reported as unhealthy.
     */
    public Mono<StoreHealth> check() {
        return Mono.defer(() -> {
            long started = clock.millis();
            return store.ping()
                    .map(healthy -> StoreHealth.builder()
                            .store(store.getType())
                            .healthy(healthy)
                            .latencyMs(clock.millis() - started)
                            .build())
                    .onErrorResume(error -> {
                        log.warn("Store health check failed: {}", error.getMessage());
                        return Mono.just(StoreHealth.builder()
                                .store(store.getType())
                                .healthy(false)
                                .error(error.getMessage())
                                .build());
                    });
        });
    }
}
