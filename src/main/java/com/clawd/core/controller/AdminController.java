package com.clawd.core.controller;

import com.clawd.core.config.TierRoutingTable;
import com.clawd.core.model.ProviderTarget;
import com.clawd.core.model.ProviderTier;
import com.clawd.core.model.StoreHealth;
import com.clawd.core.service.StoreHealthService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Operational endpoints: backing store health and the loaded routing table.
 */
@Slf4j
@RestController
@RequestMapping("/v1/admin")
public class AdminController {

    private final StoreHealthService storeHealthService;
    private final TierRoutingTable routingTable;

    public AdminController(StoreHealthService storeHealthService, TierRoutingTable routingTable) {
        this.storeHealthService = storeHealthService;
        this.routingTable = routingTable;
    }

    /**
     * 200 when the store answers, 503 otherwise.
     */
    @GetMapping("/health")
    public Mono<ResponseEntity<StoreHealth>> health() {
        return storeHealthService.check()
                .map(health -> ResponseEntity
                        .status(health.isHealthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                        .body(health));
    }

    @GetMapping("/tiers")
    public ResponseEntity<Map<ProviderTier, List<ProviderTarget>>> tiers() {
        return ResponseEntity.ok(routingTable.asMap());
    }
}
