package com.apicache.rules;

/**
 * How a request was matched to a cache rule. Used for logging only.
 *
 * <p>A discriminating rule can only win through its query constraints, and a non-discriminating
 * rule only as the fallback, so plain exact or pattern hits are reported as the fallback kinds.
 */
public enum MatchKind {
    QUERY_DISCRIMINATED("query_param"),
    FALLBACK_EXACT("fallback_exact"),
    FALLBACK_PATTERN("fallback_regex"),
    NONE_DEFAULT("default");

    private final String label;

    MatchKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
