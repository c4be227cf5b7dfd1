package com.clawd.core.controller;

import com.clawd.core.model.CompletionRequest;
import com.clawd.core.model.CompletionResponse;
import com.clawd.core.model.ProviderTier;
import com.clawd.core.service.CompletionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Tier-routed completions for collaborators running in other processes.
 */
@Slf4j
@RestController
@RequestMapping("/v1/completions")
public class CompletionController {

    private final CompletionService completionService;

    public CompletionController(CompletionService completionService) {
        this.completionService = completionService;
    }

    /**
     * Complete a request on a tier.
     *
     * @param tier     tier name or alias (fast, balanced/auto, deep/smart); balanced when absent
     * @param cacheTtl ISO-8601 duration (e.g. PT10M) to cache the response; uncached when absent
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<CompletionResponse>> complete(
            @RequestBody CompletionRequest request,
            @RequestParam(required = false) String tier,
            @RequestParam(required = false) String cacheTtl) {

        ProviderTier providerTier = ProviderTier.fromAlias(tier);
        Duration ttl = parseTtl(cacheTtl);
        log.info("Received completion request: tier={}, messages={}, tools={}, cacheTtl={}",
                providerTier,
                request.getMessages() != null ? request.getMessages().size() : 0,
                request.getTools() != null ? request.getTools().size() : 0,
                ttl);

        return completionService.complete(request, providerTier, ttl)
                .map(ResponseEntity::ok);
    }

    /**
     * Pre-flight token estimate. Approximate, not billing-accurate.
     */
    @PostMapping(value = "/estimate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> estimate(@RequestBody CompletionRequest request) {
        return ResponseEntity.ok(Map.of(
                "estimated_tokens", completionService.estimateTokens(request),
                "approximate", true
        ));
    }

    private static Duration parseTtl(String cacheTtl) {
        if (cacheTtl == null || cacheTtl.isBlank()) {
            return null;
        }
        try {
            Duration ttl = Duration.parse(cacheTtl);
            if (ttl.isZero() || ttl.isNegative()) {
                throw new IllegalArgumentException("cacheTtl must be positive: " + cacheTtl);
            }
            return ttl;
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("cacheTtl must be an ISO-8601 duration such as PT10M: " + cacheTtl, e);
        }
    }
}
