package com.apicache.rules;

import com.apicache.config.ApiCacheProperties;
import com.apicache.exception.InvalidConfigurationException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable, ordered cache and rate-limit rules, built once at startup.
 *
 * <p>All path and query-parameter patterns are compiled here; the request path never compiles
 * a pattern. Any invalid definition raises {@link InvalidConfigurationException}.
 */
@Slf4j
@Getter
public class EndpointRuleTable {

    private final List<CacheRule> cacheRules;
    private final List<RateLimitRule> rateLimitRules;
    private final RateLimitRule globalRateLimit;

    public EndpointRuleTable(List<CacheRule> cacheRules, List<RateLimitRule> rateLimitRules,
                             RateLimitRule globalRateLimit) {
        this.cacheRules = Collections.unmodifiableList(new ArrayList<>(cacheRules));
        this.rateLimitRules = Collections.unmodifiableList(new ArrayList<>(rateLimitRules));
        this.globalRateLimit = globalRateLimit;
    }

    /**
     * Validate the configuration and compile it into a rule table.
     *
     * @param properties bound application properties
     * @return rule table
     * @throws InvalidConfigurationException if any setting or pattern is invalid
     */
    public static EndpointRuleTable from(ApiCacheProperties properties) {
        validate(properties);

        List<CacheRule> cacheRules = new ArrayList<>();
        List<ApiCacheProperties.CacheEndpoint> cacheEndpoints = properties.getCache().getEndpoints();
        for (int i = 0; i < cacheEndpoints.size(); i++) {
            cacheRules.add(compileCacheRule(i, cacheEndpoints.get(i)));
        }

        List<RateLimitRule> rateLimitRules = new ArrayList<>();
        List<ApiCacheProperties.RateLimitEndpoint> limitEndpoints = properties.getRateLimit().getEndpoints();
        for (int i = 0; i < limitEndpoints.size(); i++) {
            rateLimitRules.add(compileRateLimitRule(i, limitEndpoints.get(i)));
        }

        ApiCacheProperties.RateLimitConfig rateLimit = properties.getRateLimit();
        RateLimitRule global = RateLimitRule.builder()
                .requestsPerSecond(rateLimit.getRequestsPerSecond())
                .burst(rateLimit.getBurst())
                .build();

        log.info("Built endpoint rule table: cacheRules={}, rateLimitRules={}, globalRps={}, globalBurst={}",
                cacheRules.size(), rateLimitRules.size(), global.getRequestsPerSecond(), global.getBurst());
        return new EndpointRuleTable(cacheRules, rateLimitRules, global);
    }

    private static void validate(ApiCacheProperties properties) {
        String baseUrl = properties.getUpstream().getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new InvalidConfigurationException("upstream base-url is required");
        }
        try {
            URI uri = URI.create(baseUrl);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new InvalidConfigurationException("upstream base-url must be absolute: " + baseUrl);
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("invalid upstream base-url: " + baseUrl, e);
        }

        int port = properties.getValkey().getPort();
        if (port <= 0 || port > 65535) {
            throw new InvalidConfigurationException("invalid valkey port: " + port);
        }

        ApiCacheProperties.RateLimitConfig rateLimit = properties.getRateLimit();
        requireLimit("global rate limit", rateLimit.getRequestsPerSecond(), rateLimit.getBurst());

        ApiCacheProperties.RetryConfig retry = properties.getRetry();
        if (retry.isEnabled()) {
            if (retry.getMaxAttempts() < 1) {
                throw new InvalidConfigurationException("retry max-attempts must be >= 1, got " + retry.getMaxAttempts());
            }
            if (retry.getBackoffMultiplier() < 1.0) {
                throw new InvalidConfigurationException(
                        "retry backoff-multiplier must be >= 1, got " + retry.getBackoffMultiplier());
            }
            if (retry.getInitialBackoff() == null || retry.getInitialBackoff().isNegative()
                    || retry.getMaxBackoff() == null || retry.getMaxBackoff().isNegative()) {
                throw new InvalidConfigurationException("retry backoff durations must be non-negative");
            }
        }
    }

    private static CacheRule compileCacheRule(int index, ApiCacheProperties.CacheEndpoint endpoint) {
        String where = "cache endpoint #" + index;
        requirePathOrRegex(where, endpoint.getPath(), endpoint.getPathRegex());

        CacheRule.CacheRuleBuilder builder = CacheRule.builder()
                .path(emptyToNull(endpoint.getPath()))
                .pathPattern(compile(where + " path-regex", endpoint.getPathRegex()))
                .ttl(endpoint.getTtl());

        for (String method : endpoint.getMethods()) {
            builder.method(method.trim().toUpperCase(Locale.ROOT));
        }
        builder.cacheKeyQueryParams(endpoint.getCacheKeyQueryParams());
        builder.cacheKeyHeaders(endpoint.getCacheKeyHeaders());

        for (Map.Entry<String, List<String>> entry : endpoint.getMatchQueryParams().entrySet()) {
            builder.matchQueryParam(entry.getKey(), List.copyOf(entry.getValue()));
        }

        for (Map.Entry<String, List<String>> entry : endpoint.getMatchQueryParamsRegex().entrySet()) {
            List<Pattern> patterns = new ArrayList<>();
            for (String regex : entry.getValue()) {
                patterns.add(compile(where + " query param '" + entry.getKey() + "'", regex));
            }
            builder.matchQueryParamPattern(entry.getKey(), List.copyOf(patterns));
        }

        return builder.build();
    }

    private static RateLimitRule compileRateLimitRule(int index, ApiCacheProperties.RateLimitEndpoint endpoint) {
        String where = "rate limit endpoint #" + index;
        requirePathOrRegex(where, endpoint.getPath(), endpoint.getPathRegex());
        requireLimit(where, endpoint.getRequestsPerSecond(), endpoint.getBurst());

        return RateLimitRule.builder()
                .path(emptyToNull(endpoint.getPath()))
                .pathPattern(compile(where + " path-regex", endpoint.getPathRegex()))
                .requestsPerSecond(endpoint.getRequestsPerSecond())
                .burst(endpoint.getBurst())
                .build();
    }

    private static Pattern compile(String where, String regex) {
        if (regex == null || regex.isEmpty()) {
            return null;
        }
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new InvalidConfigurationException("invalid regex for " + where + ": " + regex, e);
        }
    }

    private static void requirePathOrRegex(String where, String path, String regex) {
        if ((path == null || path.isEmpty()) && (regex == null || regex.isEmpty())) {
            throw new InvalidConfigurationException(where + " needs a path or a path-regex");
        }
    }

    private static void requireLimit(String where, double requestsPerSecond, int burst) {
        if (!(requestsPerSecond > 0)) {
            throw new InvalidConfigurationException(where + ": requests-per-second must be > 0");
        }
        if (burst < 1) {
            throw new InvalidConfigurationException(where + ": burst must be >= 1");
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
