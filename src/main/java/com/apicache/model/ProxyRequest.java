package com.apicache.model;

import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

/**
 * Inbound request as seen by the forwarding engine. The body is fully buffered so it can be
 * replayed on every retry attempt.
 */
@Value
@Builder
public class ProxyRequest {

    String requestId;

    HttpMethod method;

    /**
     * Decoded path, used for rule matching, cache keys and limiter lookup.
     */
    String path;

    /**
     * Raw (still encoded) path, forwarded upstream unchanged.
     */
    String rawPath;

    /**
     * Raw query string without '?', or null.
     */
    String rawQuery;

    @Builder.Default
    MultiValueMap<String, String> queryParams = new LinkedMultiValueMap<>();

    @Builder.Default
    HttpHeaders headers = new HttpHeaders();

    @Builder.Default
    byte[] body = new byte[0];

    public boolean isGet() {
        return HttpMethod.GET.equals(method);
    }
}
