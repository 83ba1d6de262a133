package com.apicache.rules;

import lombok.Builder;
import lombok.Value;

import java.util.regex.Pattern;

/**
 * One configured limiting policy. The global defaults are represented by a rule with no path.
 */
@Value
@Builder
public class RateLimitRule {

    String path;

    Pattern pathPattern;

    double requestsPerSecond;

    int burst;

    public String identifier() {
        if (path != null && !path.isEmpty()) {
            return path;
        }
        if (pathPattern != null) {
            return "regex:" + pathPattern.pattern();
        }
        return "<global>";
    }
}
