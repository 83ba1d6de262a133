package com.apicache.ratelimit;

import com.apicache.config.ApiCacheProperties;
import com.apicache.rules.EndpointResolver;
import com.apicache.rules.RateLimitRule;
import com.apicache.web.RequestIdWebFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Admission gate: denies requests over the per-path token bucket with a fixed 429 body.
 * Denied requests never reach the cache or upstream.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class RateLimitWebFilter implements WebFilter {

    public static final String REJECTION_BODY = "{\"error\":\"rate limit exceeded\",\"message\":\"too many requests\"}";

    private static final String HEALTH_PATH = "/health";
    private static final String ADMIN_PREFIX = "/_admin/";

    private final ApiCacheProperties properties;
    private final EndpointResolver endpointResolver;
    private final RateLimiterRegistry registry;

    public RateLimitWebFilter(ApiCacheProperties properties,
                              EndpointResolver endpointResolver,
                              RateLimiterRegistry registry) {
        this.properties = properties;
        this.endpointResolver = endpointResolver;
        this.registry = registry;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!properties.getRateLimit().isEnabled()) {
            return chain.filter(exchange);
        }

        ServerHttpRequest request = exchange.getRequest();
        String path = request.getURI().getPath();
        if (isExempt(path)) {
            return chain.filter(exchange);
        }

        RateLimitRule rule = endpointResolver.resolveRateLimit(path);
        if (registry.allow(path, rule)) {
            return chain.filter(exchange);
        }

        log.warn("Rate limit exceeded: requestId={}, method={}, path={}, remote={}",
                RequestIdWebFilter.requestId(exchange), request.getMethod(), path, request.getRemoteAddress());
        return reject(exchange.getResponse());
    }

    /**
     * Health is always exempt; admin paths only while the admin endpoints are served locally.
     */
    private boolean isExempt(String path) {
        if (HEALTH_PATH.equals(path)) {
            return true;
        }
        return properties.getAdmin().isEnabled() && path.startsWith(ADMIN_PREFIX);
    }

    private Mono<Void> reject(ServerHttpResponse response) {
        response.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        DataBuffer buffer = response.bufferFactory().wrap(REJECTION_BODY.getBytes(StandardCharsets.UTF_8));
        return response.writeWith(Mono.just(buffer));
    }
}
