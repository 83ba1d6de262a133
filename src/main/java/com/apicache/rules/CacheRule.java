package com.apicache.rules;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One configured caching policy. Built once by {@link EndpointRuleTable}; immutable and shared
 * read-only by all requests.
 */
@Value
@Builder
public class CacheRule {

    /**
     * Exact request path, or null.
     */
    String path;

    /**
     * Compiled path pattern (unanchored find), or null.
     */
    Pattern pathPattern;

    @Singular
    Set<String> methods;

    /**
     * Time-to-live for stored responses; null or non-positive means "use the default TTL".
     */
    Duration ttl;

    @Singular
    List<String> cacheKeyQueryParams;

    @Singular
    List<String> cacheKeyHeaders;

    /**
     * Query parameter -> allowed literal values.
     */
    @Singular
    Map<String, List<String>> matchQueryParams;

    /**
     * Query parameter -> compiled patterns; any one must match.
     */
    @Singular
    Map<String, List<Pattern>> matchQueryParamPatterns;

    /**
     * A discriminating rule only applies when its query parameter constraints hold.
     */
    public boolean isDiscriminating() {
        return !matchQueryParams.isEmpty() || !matchQueryParamPatterns.isEmpty();
    }

    public boolean hasPositiveTtl() {
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }

    /**
     * Human-readable identifier for log lines.
     */
    public String identifier() {
        if (path != null && !path.isEmpty()) {
            return path;
        }
        if (pathPattern != null) {
            return "regex:" + pathPattern.pattern();
        }
        return "<unknown>";
    }
}
