package com.apicache.ratelimit;

import com.apicache.rules.EndpointRuleTable;
import com.apicache.rules.RateLimitRule;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.TimeMeter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One token bucket per distinct request path, created on first sight and kept for the life of
 * the process.
 *
 * <p>Lookups take the read lock. A missing path upgrades to the write lock and re-checks before
 * creating the bucket, so at most one bucket is ever observable per path. Buckets are seeded
 * with the endpoint rule's rate and burst, or the global defaults when no rule matched; the
 * values are fixed at creation time.
 */
@Slf4j
@Component
public class RateLimiterRegistry {

    private final Map<String, Bucket> limiters = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final RateLimitRule globalDefaults;
    private final TimeMeter timeMeter;

    @Autowired
    public RateLimiterRegistry(EndpointRuleTable ruleTable) {
        this(ruleTable.getGlobalRateLimit(), TimeMeter.SYSTEM_NANOTIME);
    }

    public RateLimiterRegistry(RateLimitRule globalDefaults, TimeMeter timeMeter) {
        this.globalDefaults = globalDefaults;
        this.timeMeter = timeMeter;
    }

    /**
     * Try to admit one request for a path. Never blocks.
     *
     * @param path request path
     * @param rule endpoint rule, or null for the global defaults
     * @return true if a token was available
     */
    public boolean allow(String path, RateLimitRule rule) {
        return getLimiter(path, rule).tryConsume(1);
    }

    /**
     * Get the bucket for a path, creating it if this is the first request for the path.
     */
    public Bucket getLimiter(String path, RateLimitRule rule) {
        lock.readLock().lock();
        try {
            Bucket existing = limiters.get(path);
            if (existing != null) {
                return existing;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            // Another thread may have inserted it between the read unlock and the write lock
            Bucket existing = limiters.get(path);
            if (existing != null) {
                return existing;
            }

            RateLimitRule effective = rule != null ? rule : globalDefaults;
            Bucket bucket = createBucket(effective.getRequestsPerSecond(), effective.getBurst());
            limiters.put(path, bucket);

            log.debug("Created rate limiter: path={}, rule={}, rps={}, burst={}",
                    path, effective.identifier(), effective.getRequestsPerSecond(), effective.getBurst());
            return bucket;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean hasLimiter(String path) {
        lock.readLock().lock();
        try {
            return limiters.containsKey(path);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Number of paths with a live limiter.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return limiters.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Token bucket with capacity = burst, refilled greedily with one token every 1/rps seconds.
     */
    private Bucket createBucket(double requestsPerSecond, int burst) {
        long periodNanos = Math.max(1L, Math.round(1_000_000_000d / requestsPerSecond));

        Bandwidth bandwidth = Bandwidth.builder()
                .capacity(burst)
                .refillGreedy(1, Duration.ofNanos(periodNanos))
                .build();

        return Bucket.builder()
                .addLimit(bandwidth)
                .withCustomTimePrecision(timeMeter)
                .build();
    }
}
