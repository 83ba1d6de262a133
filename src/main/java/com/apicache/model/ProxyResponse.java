package com.apicache.model;

import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpHeaders;

/**
 * Response assembled by the forwarding engine, with cache metadata.
 */
@Value
@Builder
public class ProxyResponse {

    int statusCode;

    HttpHeaders headers;

    byte[] body;

    /**
     * "HIT", "MISS", or null for non-GET requests.
     */
    String cacheStatus;

    /**
     * Whether a MISS response was written to the store.
     */
    boolean stored;

    public boolean isCacheHit() {
        return CacheHeaders.HIT.equals(cacheStatus);
    }
}
