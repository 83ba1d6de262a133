package com.apicache.controller;

import com.apicache.repository.CacheStore;
import com.apicache.service.CacheKeyGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Cache invalidation. Only keys under the proxy's own prefix can be removed.
 */
@Slf4j
@RestController
@RequestMapping("/_admin/cache")
@ConditionalOnProperty(prefix = "api-cache.admin", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CacheAdminController {

    private final CacheStore cacheStore;

    public CacheAdminController(CacheStore cacheStore) {
        this.cacheStore = cacheStore;
    }

    /**
     * Delete one entry by its full key ({@code cache:<hex>}).
     */
    @DeleteMapping("/{key}")
    public Mono<ResponseEntity<Map<String, Object>>> deleteKey(@PathVariable String key) {
        if (!key.startsWith(CacheKeyGenerator.KEY_PREFIX)) {
            return Mono.just(badRequest("key must start with " + CacheKeyGenerator.KEY_PREFIX));
        }

        log.info("Cache delete requested: key={}", key);
        return cacheStore.delete(key)
                .map(deleted -> ResponseEntity.ok(Map.<String, Object>of(
                        "key", key,
                        "deleted", deleted)));
    }

    /**
     * Delete every entry matching a glob pattern, e.g. {@code cache:*}.
     */
    @DeleteMapping
    public Mono<ResponseEntity<Map<String, Object>>> deleteByPattern(
            @RequestParam(defaultValue = CacheKeyGenerator.KEY_PREFIX + "*") String pattern) {
        if (!pattern.startsWith(CacheKeyGenerator.KEY_PREFIX)) {
            return Mono.just(badRequest("pattern must start with " + CacheKeyGenerator.KEY_PREFIX));
        }

        log.info("Cache clear requested: pattern={}", pattern);
        return cacheStore.deleteByPrefix(pattern)
                .map(count -> ResponseEntity.ok(Map.<String, Object>of(
                        "pattern", pattern,
                        "deleted", count)));
    }

    private static ResponseEntity<Map<String, Object>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
