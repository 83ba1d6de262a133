package com.apicache.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for api-cache.
 */
@Data
@Component
@ConfigurationProperties(prefix = "api-cache")
public class ApiCacheProperties {

    private ValkeyConfig valkey = new ValkeyConfig();
    private CacheConfig cache = new CacheConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private RetryConfig retry = new RetryConfig();
    private UpstreamConfig upstream = new UpstreamConfig();
    private LoggingConfig logging = new LoggingConfig();
    private AdminConfig admin = new AdminConfig();

    @Data
    public static class ValkeyConfig {
        private String host = "localhost";
        private int port = 6379;
        private String password;
        private int database = 0;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration commandTimeout = Duration.ofSeconds(2);
    }

    @Data
    public static class CacheConfig {
        private Duration defaultTtl = Duration.ofMinutes(5);
        private boolean compressionEnabled = false;
        private List<CacheEndpoint> endpoints = new ArrayList<>();
    }

    @Data
    public static class CacheEndpoint {
        private String path;
        private String pathRegex;
        private List<String> methods = new ArrayList<>(List.of("GET"));
        private Duration ttl;
        private List<String> cacheKeyQueryParams = new ArrayList<>();
        private List<String> cacheKeyHeaders = new ArrayList<>();
        private Map<String, List<String>> matchQueryParams = new LinkedHashMap<>();
        private Map<String, List<String>> matchQueryParamsRegex = new LinkedHashMap<>();
    }

    @Data
    public static class RateLimitConfig {
        private boolean enabled = true;
        private double requestsPerSecond = 10.0;
        private int burst = 20;
        private List<RateLimitEndpoint> endpoints = new ArrayList<>();
    }

    @Data
    public static class RateLimitEndpoint {
        private String path;
        private String pathRegex;
        private double requestsPerSecond;
        private int burst;
    }

    @Data
    public static class RetryConfig {
        private boolean enabled = true;
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(100);
        private Duration maxBackoff = Duration.ofSeconds(2);
        private double backoffMultiplier = 2.0;
        private Set<Integer> retryableStatusCodes = new LinkedHashSet<>(List.of(502, 503, 504));
    }

    @Data
    public static class UpstreamConfig {
        private String baseUrl;
        private Duration timeout = Duration.ofSeconds(30);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private int maxConnections = 100;
        private int maxResponseSize = 16 * 1024 * 1024;
    }

    @Data
    public static class LoggingConfig {
        /**
         * Query parameters whose values are replaced with [REDACTED] in log lines.
         */
        private List<String> redactQueryParams = new ArrayList<>();
    }

    @Data
    public static class AdminConfig {
        private boolean enabled = true;
    }
}
