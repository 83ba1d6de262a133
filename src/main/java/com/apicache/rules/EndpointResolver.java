package com.apicache.rules;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.MultiValueMap;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Resolves which cache rule and which rate-limit rule apply to a request.
 *
 * <p>Cache resolution walks the rules once, in configured order:
 * <ol>
 *   <li>rules for other methods are skipped;</li>
 *   <li>the path must match exactly, or else match the rule's pattern;</li>
 *   <li>the first non-discriminating rule seen becomes the fallback and the walk continues;</li>
 *   <li>a discriminating rule whose constraints all hold wins immediately;</li>
 *   <li>otherwise the fallback wins, or nothing (caller uses the default TTL).</li>
 * </ol>
 * Query parameters are judged by their first value only.
 */
@Slf4j
@Service
public class EndpointResolver {

    private final EndpointRuleTable ruleTable;

    public EndpointResolver(EndpointRuleTable ruleTable) {
        this.ruleTable = ruleTable;
    }

    /**
     * Resolve the cache rule for a request.
     *
     * @param path        request path
     * @param method      HTTP method (upper case)
     * @param queryParams request query parameters, may be null
     * @return match result, never null
     */
    public MatchResult resolveCache(String path, String method, MultiValueMap<String, String> queryParams) {
        CacheRule fallback = null;
        MatchKind fallbackKind = MatchKind.NONE_DEFAULT;

        for (CacheRule rule : ruleTable.getCacheRules()) {
            if (!rule.getMethods().contains(method)) {
                continue;
            }

            boolean exact = rule.getPath() != null && rule.getPath().equals(path);
            if (!exact && !matches(rule.getPathPattern(), path)) {
                continue;
            }

            if (!rule.isDiscriminating()) {
                if (fallback == null) {
                    fallback = rule;
                    fallbackKind = exact ? MatchKind.FALLBACK_EXACT : MatchKind.FALLBACK_PATTERN;
                }
                continue;
            }

            if (queryConstraintsHold(rule, queryParams)) {
                log.debug("Cache rule matched by query params: rule={}, path={}", rule.identifier(), path);
                return MatchResult.of(rule, MatchKind.QUERY_DISCRIMINATED);
            }
        }

        return fallback != null ? MatchResult.of(fallback, fallbackKind) : MatchResult.none();
    }

    /**
     * Resolve the rate-limit rule for a path: first exact hit, otherwise first pattern hit.
     *
     * @param path request path
     * @return matching rule, or null when the global limits apply
     */
    public RateLimitRule resolveRateLimit(String path) {
        RateLimitRule patternHit = null;
        for (RateLimitRule rule : ruleTable.getRateLimitRules()) {
            if (rule.getPath() != null && rule.getPath().equals(path)) {
                return rule;
            }
            if (patternHit == null && matches(rule.getPathPattern(), path)) {
                patternHit = rule;
            }
        }
        return patternHit;
    }

    private boolean queryConstraintsHold(CacheRule rule, MultiValueMap<String, String> queryParams) {
        for (Map.Entry<String, List<String>> constraint : rule.getMatchQueryParams().entrySet()) {
            String value = firstValue(queryParams, constraint.getKey());
            if (value == null || !constraint.getValue().contains(value)) {
                return false;
            }
        }

        for (Map.Entry<String, List<Pattern>> constraint : rule.getMatchQueryParamPatterns().entrySet()) {
            String value = firstValue(queryParams, constraint.getKey());
            if (value == null) {
                return false;
            }
            boolean anyMatch = false;
            for (Pattern pattern : constraint.getValue()) {
                if (pattern.matcher(value).find()) {
                    anyMatch = true;
                    break;
                }
            }
            if (!anyMatch) {
                return false;
            }
        }
        return true;
    }

    /**
     * First supplied value of a parameter; absent or empty counts as no value.
     */
    private static String firstValue(MultiValueMap<String, String> queryParams, String name) {
        if (queryParams == null) {
            return null;
        }
        String value = queryParams.getFirst(name);
        return value == null || value.isEmpty() ? null : value;
    }

    private static boolean matches(Pattern pattern, String path) {
        return pattern != null && pattern.matcher(path).find();
    }
}
