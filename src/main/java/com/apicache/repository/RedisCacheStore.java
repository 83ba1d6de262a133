package com.apicache.repository;

import com.apicache.exception.CacheStoreException;
import com.apicache.model.CachedEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Redis/Valkey-backed cache store. Expiry is left entirely to the store's TTL.
 */
@Slf4j
@Repository
public class RedisCacheStore implements CacheStore {

    private static final long SCAN_BATCH = 500;

    private final ReactiveRedisTemplate<String, byte[]> redisTemplate;
    private final CachedEntryCodec codec;

    public RedisCacheStore(ReactiveRedisTemplate<String, byte[]> redisTemplate, CachedEntryCodec codec) {
        this.redisTemplate = redisTemplate;
        this.codec = codec;
    }

    @Override
    public Mono<CachedEntry> get(String key) {
        return redisTemplate.opsForValue().get(key)
                .map(codec::decode)
                .doOnNext(entry -> log.debug("Cache hit: key={}", key))
                .onErrorMap(e -> !(e instanceof CacheStoreException),
                        e -> new CacheStoreException("failed to get cache entry: " + key, e));
    }

    @Override
    public Mono<Void> set(String key, CachedEntry entry, Duration ttl) {
        return Mono.fromCallable(() -> codec.encode(entry))
                .flatMap(data -> redisTemplate.opsForValue().set(key, data, ttl)
                        .doOnSuccess(ok -> log.debug("Cached response: key={}, ttl={}s, size={}B",
                                key, ttl.toSeconds(), data.length)))
                .onErrorMap(e -> !(e instanceof CacheStoreException),
                        e -> new CacheStoreException("failed to set cache entry: " + key, e))
                .then();
    }

    @Override
    public Mono<Boolean> delete(String key) {
        return redisTemplate.delete(key)
                .map(count -> count > 0)
                .doOnNext(removed -> log.debug("Deleted from cache: key={}, removed={}", key, removed))
                .onErrorMap(e -> new CacheStoreException("failed to delete cache entry: " + key, e));
    }

    @Override
    public Mono<Long> deleteByPrefix(String pattern) {
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH).build();
        return redisTemplate.scan(options)
                .concatMap(key -> redisTemplate.delete(key)
                        .onErrorResume(e -> {
                            log.error("Failed to delete cache key: key={}", key, e);
                            return Mono.just(0L);
                        }))
                .reduce(0L, Long::sum)
                .doOnNext(count -> log.info("Cleared {} entries from cache: pattern={}", count, pattern))
                .onErrorMap(e -> new CacheStoreException("failed to scan cache: " + pattern, e));
    }
}
