package com.apicache.web;

import com.apicache.config.ApiCacheProperties;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Replaces the values of configured sensitive query parameters with [REDACTED] before a query
 * string is written to the log. Parameter order is kept; repeated parameters are grouped at the
 * position of their first occurrence.
 */
@Component
public class QuerySanitizer {

    static final String REDACTED = "[REDACTED]";

    private final Set<String> redactedParams;

    public QuerySanitizer(ApiCacheProperties properties) {
        this.redactedParams = Set.copyOf(properties.getLogging().getRedactQueryParams());
    }

    /**
     * @param rawQuery raw (encoded) query string without the leading '?', may be null
     * @return query safe to log
     */
    public String sanitize(String rawQuery) {
        if (redactedParams.isEmpty() || rawQuery == null || rawQuery.isEmpty()) {
            return rawQuery;
        }

        Map<String, List<String>> grouped = new LinkedHashMap<>();
        Set<String> rawNames = new HashSet<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String rawName = eq >= 0 ? pair.substring(0, eq) : pair;
            String name = decode(rawName);
            rawNames.add(name);
            grouped.computeIfAbsent(name, k -> new ArrayList<>()).add(pair);
        }

        if (redactedParams.stream().noneMatch(rawNames::contains)) {
            return rawQuery;
        }

        List<String> parts = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : grouped.entrySet()) {
            if (redactedParams.contains(entry.getKey())) {
                // Repeated sensitive params collapse into one redacted value
                parts.add(entry.getValue().get(0).split("=", 2)[0] + "=" + REDACTED);
            } else {
                parts.addAll(entry.getValue());
            }
        }
        return String.join("&", parts);
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }
}
