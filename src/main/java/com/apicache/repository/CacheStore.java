package com.apicache.repository;

import com.apicache.model.CachedEntry;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Key-value store holding cached responses.
 *
 * <p>All operations are lazy and cancellable. Faults are signalled as
 * {@link com.apicache.exception.CacheStoreException}; "not found" is an empty {@link Mono}, not an error.
 */
public interface CacheStore {

    /**
     * @param key cache key
     * @return the entry, empty when not found, or an error on a store fault
     */
    Mono<CachedEntry> get(String key);

    /**
     * Store an entry, replacing any previous one, expiring after {@code ttl}.
     */
    Mono<Void> set(String key, CachedEntry entry, Duration ttl);

    /**
     * @return true if an entry was removed
     */
    Mono<Boolean> delete(String key);

    /**
     * Remove every key matching a glob pattern (e.g. {@code cache:*}).
     *
     * @return number of keys removed
     */
    Mono<Long> deleteByPrefix(String pattern);
}
