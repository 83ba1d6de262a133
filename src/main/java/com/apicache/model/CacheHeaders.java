package com.apicache.model;

/**
 * HTTP headers added by the proxy.
 */
public class CacheHeaders {

    /**
     * Whether a GET response came from cache.
     * Values: "HIT", "MISS"
     */
    public static final String X_CACHE = "X-Cache";

    /**
     * Original storage time of a cached response (RFC 3339).
     *
     * Only present for cache hits.
     */
    public static final String X_CACHE_TIME = "X-Cache-Time";

    public static final String HIT = "HIT";
    public static final String MISS = "MISS";

    private CacheHeaders() {
        // Utility class, no instantiation
    }
}
