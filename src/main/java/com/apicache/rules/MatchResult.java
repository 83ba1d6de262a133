package com.apicache.rules;

import lombok.Value;

import java.util.Optional;

/**
 * Result of cache rule resolution: the matched rule (may be null) and how it matched.
 */
@Value
public class MatchResult {

    private static final MatchResult NONE = new MatchResult(null, MatchKind.NONE_DEFAULT);

    CacheRule rule;

    MatchKind kind;

    public static MatchResult of(CacheRule rule, MatchKind kind) {
        return new MatchResult(rule, kind);
    }

    public static MatchResult none() {
        return NONE;
    }

    public boolean isMatched() {
        return rule != null;
    }

    public Optional<CacheRule> getRuleOptional() {
        return Optional.ofNullable(rule);
    }
}
