package com.apicache.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Upstream response as stored in the cache. Only ever written for 2xx responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedEntry {

    @JsonProperty("status_code")
    private int statusCode;

    /**
     * Response headers, multi-valued, in upstream order.
     */
    @Builder.Default
    @JsonProperty("headers")
    private Map<String, List<String>> headers = new LinkedHashMap<>();

    /**
     * Response body bytes (base64 in JSON).
     */
    @JsonProperty("body")
    private byte[] body;

    /**
     * When this entry was stored.
     */
    @JsonProperty("cached_at")
    private Instant cachedAt;
}
