package com.apicache.service;

import com.apicache.rules.CacheRule;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.util.MultiValueMap;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Derives stable cache keys for GET requests.
 *
 * <p>Components: method, path, then the rule's key-relevant query parameters ({@code name=value},
 * sorted, joined with {@code &}), then its key-relevant headers (sorted, joined with {@code |}).
 * Components are joined with {@code :} and hashed with SHA-256.
 *
 * Key pattern: cache:{sha256}
 */
@Service
public class CacheKeyGenerator {

    public static final String KEY_PREFIX = "cache:";

    /**
     * Generate cache key for a request.
     *
     * @param method      HTTP method
     * @param path        request path
     * @param queryParams request query parameters, may be null
     * @param headers     request headers, may be null
     * @param rule        matched cache rule, or null when none matched
     * @return key of the form {@code cache:<64 hex chars>}
     */
    public String generateKey(String method, String path, MultiValueMap<String, String> queryParams,
                              HttpHeaders headers, CacheRule rule) {
        List<String> parts = new ArrayList<>();
        parts.add(method);
        parts.add(path);

        if (rule != null && !rule.getCacheKeyQueryParams().isEmpty() && queryParams != null) {
            List<String> queryParts = new ArrayList<>();
            for (String param : rule.getCacheKeyQueryParams()) {
                String value = queryParams.getFirst(param);
                if (value != null && !value.isEmpty()) {
                    queryParts.add(param + "=" + value);
                }
            }
            addSorted(parts, queryParts, "&");
        }

        if (rule != null && !rule.getCacheKeyHeaders().isEmpty() && headers != null) {
            List<String> headerParts = new ArrayList<>();
            for (String header : rule.getCacheKeyHeaders()) {
                String value = headers.getFirst(header);
                if (value != null && !value.isEmpty()) {
                    headerParts.add(header + "=" + value);
                }
            }
            addSorted(parts, headerParts, "|");
        }

        String keyString = String.join(":", parts);
        return KEY_PREFIX + DigestUtils.sha256Hex(keyString.getBytes(StandardCharsets.UTF_8));
    }

    private static void addSorted(List<String> parts, List<String> component, String separator) {
        if (component.isEmpty()) {
            return;
        }
        Collections.sort(component);
        parts.add(String.join(separator, component));
    }
}
