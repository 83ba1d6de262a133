package com.apicache.ratelimit;

import com.apicache.config.ApiCacheProperties;
import com.apicache.rules.EndpointResolver;
import com.apicache.rules.EndpointRuleTable;
import com.apicache.rules.RateLimitRule;
import io.github.bucket4j.TimeMeter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RateLimitWebFilter.
 */
class RateLimitWebFilterTest {

    private ApiCacheProperties properties;
    private RateLimitWebFilter filter;
    private AtomicInteger forwarded;
    private WebFilterChain chain;

    @BeforeEach
    void setUp() {
        properties = new ApiCacheProperties();
        RateLimitRule global = RateLimitRule.builder().requestsPerSecond(1).burst(2).build();
        RateLimitRule query = RateLimitRule.builder()
                .pathPattern(Pattern.compile("^/query")).requestsPerSecond(1).burst(1).build();
        EndpointRuleTable table = new EndpointRuleTable(List.of(), List.of(query), global);

        // Frozen clock: no refill during the test
        TimeMeter frozen = new TimeMeter() {
            @Override
            public long currentTimeNanos() {
                return 0L;
            }

            @Override
            public boolean isWallClockBased() {
                return false;
            }
        };
        filter = new RateLimitWebFilter(properties, new EndpointResolver(table),
                new RateLimiterRegistry(global, frozen));

        forwarded = new AtomicInteger();
        chain = exchange -> {
            forwarded.incrementAndGet();
            return Mono.empty();
        };
    }

    private MockServerWebExchange get(String path) {
        return MockServerWebExchange.from(MockServerHttpRequest.get(path));
    }

    @Test
    void testRejectsOverLimitWith429() {
        filter.filter(get("/query"), chain).block();

        MockServerWebExchange rejected = get("/query");
        filter.filter(rejected, chain).block();

        assertEquals(1, forwarded.get());
        assertEquals(HttpStatus.TOO_MANY_REQUESTS, rejected.getResponse().getStatusCode());
        assertEquals(MediaType.APPLICATION_JSON, rejected.getResponse().getHeaders().getContentType());
        assertEquals(RateLimitWebFilter.REJECTION_BODY, rejected.getResponse().getBodyAsString().block());
    }

    @Test
    void testGlobalDefaultsForUnmatchedPath() {
        for (int i = 0; i < 3; i++) {
            filter.filter(get("/other"), chain).block();
        }
        assertEquals(2, forwarded.get());
    }

    @Test
    void testHealthAndAdminAreExempt() {
        for (int i = 0; i < 5; i++) {
            filter.filter(get("/health"), chain).block();
            filter.filter(MockServerWebExchange.from(MockServerHttpRequest.delete("/_admin/cache")), chain).block();
        }
        assertEquals(10, forwarded.get());
    }

    @Test
    void testAdminPathsLimitedWhenAdminDisabled() {
        properties.getAdmin().setEnabled(false);

        for (int i = 0; i < 3; i++) {
            filter.filter(get("/_admin/cache"), chain).block();
        }
        MockServerWebExchange rejected = get("/_admin/cache");
        filter.filter(rejected, chain).block();

        assertEquals(2, forwarded.get());
        assertEquals(HttpStatus.TOO_MANY_REQUESTS, rejected.getResponse().getStatusCode());
    }

    @Test
    void testDisabledPassesEverything() {
        properties.getRateLimit().setEnabled(false);
        for (int i = 0; i < 5; i++) {
            filter.filter(get("/query"), chain).block();
        }
        assertEquals(5, forwarded.get());
    }
}
