package com.apicache.service;

import com.apicache.config.ApiCacheProperties;
import com.apicache.exception.CacheStoreException;
import com.apicache.exception.UpstreamBodyReadException;
import com.apicache.exception.UpstreamUnavailableException;
import com.apicache.model.CacheHeaders;
import com.apicache.model.CachedEntry;
import com.apicache.model.ProxyRequest;
import com.apicache.model.ProxyResponse;
import com.apicache.repository.CacheStore;
import com.apicache.rules.CacheRule;
import com.apicache.rules.EndpointResolver;
import com.apicache.rules.EndpointRuleTable;
import com.apicache.rules.RateLimitRule;
import com.apicache.web.QuerySanitizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ForwardingEngine: cache lookup/populate and retry behaviour against a stubbed upstream.
 */
class ForwardingEngineTest {

    private ApiCacheProperties properties;
    private InMemoryCacheStore cacheStore;
    private StubUpstream upstream;
    private CacheKeyGenerator keyGenerator;
    private ForwardingEngine engine;

    @BeforeEach
    void setUp() {
        properties = new ApiCacheProperties();
        properties.getUpstream().setBaseUrl("http://upstream.local");
        properties.getUpstream().setTimeout(Duration.ofMillis(200));
        properties.getCache().setDefaultTtl(Duration.ofMinutes(5));
        properties.getRetry().setInitialBackoff(Duration.ofMillis(10));
        properties.getRetry().setMaxBackoff(Duration.ofMillis(50));
        properties.getRetry().setBackoffMultiplier(2.0);
        properties.getRetry().setMaxAttempts(3);

        CacheRule endOfPeriod = CacheRule.builder()
                .path("/query").method("GET").ttl(Duration.ofHours(24))
                .matchQueryParam("function", List.of("EOD"))
                .cacheKeyQueryParam("function")
                .cacheKeyQueryParam("symbol")
                .build();
        EndpointRuleTable table = new EndpointRuleTable(List.of(endOfPeriod), List.of(),
                RateLimitRule.builder().requestsPerSecond(10).burst(20).build());

        cacheStore = new InMemoryCacheStore();
        upstream = new StubUpstream();
        keyGenerator = new CacheKeyGenerator();

        WebClient webClient = WebClient.builder().exchangeFunction(upstream).build();
        engine = new ForwardingEngine(properties, new EndpointResolver(table), keyGenerator, cacheStore,
                new UpstreamClient(webClient, properties), new QuerySanitizer(properties));
    }

    private static ProxyRequest get(String path, String... pairs) {
        MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        StringBuilder raw = new StringBuilder();
        for (int i = 0; i < pairs.length; i += 2) {
            params.add(pairs[i], pairs[i + 1]);
            raw.append(raw.length() > 0 ? "&" : "").append(pairs[i]).append('=').append(pairs[i + 1]);
        }
        return ProxyRequest.builder()
                .requestId("test")
                .method(HttpMethod.GET)
                .path(path)
                .rawPath(path)
                .rawQuery(raw.length() > 0 ? raw.toString() : null)
                .queryParams(params)
                .build();
    }

    private static Mono<ClientResponse> ok(String body) {
        return Mono.just(ClientResponse.create(HttpStatus.OK)
                .header("Content-Type", "application/json")
                .body(body)
                .build());
    }

    private static Mono<ClientResponse> status(HttpStatus status) {
        return Mono.just(ClientResponse.create(status).body("status " + status.value()).build());
    }

    private static Mono<ClientResponse> refused() {
        return Mono.error(new WebClientRequestException(new ConnectException("connection refused"),
                HttpMethod.GET, URI.create("http://upstream.local"), new HttpHeaders()));
    }

    private static String body(ProxyResponse response) {
        return new String(response.getBody(), StandardCharsets.UTF_8);
    }

    @Test
    void testMissPopulatesCacheWithRuleTtl() {
        upstream.enqueue(ok("{\"v\":1}"));

        ProxyResponse response = engine.handle(get("/query", "function", "EOD", "symbol", "IBM")).block();

        assertNotNull(response);
        assertEquals(200, response.getStatusCode());
        assertEquals(CacheHeaders.MISS, response.getHeaders().getFirst(CacheHeaders.X_CACHE));
        assertTrue(response.isStored());
        assertEquals(1, cacheStore.entries.size());
        assertEquals(Duration.ofHours(24), cacheStore.ttls.values().iterator().next());
    }

    @Test
    void testUnmatchedRequestUsesDefaultTtl() {
        upstream.enqueue(ok("{}"));

        engine.handle(get("/other")).block();

        assertEquals(Duration.ofMinutes(5), cacheStore.ttls.values().iterator().next());
    }

    @Test
    void testHitServedVerbatimWithoutUpstream() {
        upstream.enqueue(ok("{\"v\":1}"));
        engine.handle(get("/query", "function", "EOD", "symbol", "IBM")).block();

        ProxyResponse hit = engine.handle(get("/query", "function", "EOD", "symbol", "IBM")).block();

        assertNotNull(hit);
        assertTrue(hit.isCacheHit());
        assertEquals(1, upstream.calls.get());
        assertEquals(200, hit.getStatusCode());
        assertEquals("{\"v\":1}", body(hit));
        assertEquals("application/json", hit.getHeaders().getFirst("Content-Type"));
        assertEquals(CacheHeaders.HIT, hit.getHeaders().getFirst(CacheHeaders.X_CACHE));
        assertTrue(hit.getHeaders().getFirst(CacheHeaders.X_CACHE_TIME)
                .matches("\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z"));
    }

    @Test
    void testUnconfiguredParamsShareCacheEntry() {
        upstream.enqueue(ok("{\"v\":1}"));
        engine.handle(get("/query", "function", "EOD", "symbol", "IBM")).block();

        ProxyResponse hit = engine.handle(get("/query", "function", "EOD", "symbol", "IBM", "page", "3")).block();

        assertNotNull(hit);
        assertTrue(hit.isCacheHit());
    }

    @Test
    void testNonSuccessIsNotCached() {
        upstream.enqueue(status(HttpStatus.NOT_FOUND));

        ProxyResponse response = engine.handle(get("/query", "function", "EOD")).block();

        assertNotNull(response);
        assertEquals(404, response.getStatusCode());
        assertEquals(CacheHeaders.MISS, response.getHeaders().getFirst(CacheHeaders.X_CACHE));
        assertFalse(response.isStored());
        assertTrue(cacheStore.entries.isEmpty());
        assertEquals(1, upstream.calls.get());
    }

    @Test
    void testNonGetBypassesCache() {
        upstream.enqueue(ok("created"));
        ProxyRequest post = ProxyRequest.builder()
                .requestId("test")
                .method(HttpMethod.POST)
                .path("/query")
                .rawPath("/query")
                .body("payload".getBytes(StandardCharsets.UTF_8))
                .build();

        ProxyResponse response = engine.handle(post).block();

        assertNotNull(response);
        assertNull(response.getCacheStatus());
        assertFalse(response.getHeaders().containsKey(CacheHeaders.X_CACHE));
        assertEquals(0, cacheStore.getCalls.get());
        assertTrue(cacheStore.entries.isEmpty());
        assertEquals(HttpMethod.POST, upstream.lastRequest.method());
    }

    @Test
    void testStoreReadFailureIsTreatedAsMiss() {
        cacheStore.failGets = true;
        upstream.enqueue(ok("fresh"));

        ProxyResponse response = engine.handle(get("/query", "function", "EOD")).block();

        assertNotNull(response);
        assertEquals("fresh", body(response));
        assertEquals(CacheHeaders.MISS, response.getHeaders().getFirst(CacheHeaders.X_CACHE));
    }

    @Test
    void testStoreWriteFailureStillReturnsResponse() {
        cacheStore.failSets = true;
        upstream.enqueue(ok("fresh"));

        ProxyResponse response = engine.handle(get("/query", "function", "EOD")).block();

        assertNotNull(response);
        assertEquals(200, response.getStatusCode());
        assertFalse(response.isStored());
    }

    @Test
    void testMalformedEntryIsTreatedAsMiss() {
        String key = keyGenerator.generateKey("GET", "/other", new LinkedMultiValueMap<>(), new HttpHeaders(), null);
        cacheStore.entries.put(key, CachedEntry.builder().statusCode(0).build());
        upstream.enqueue(ok("fresh"));

        ProxyResponse response = engine.handle(get("/other")).block();

        assertNotNull(response);
        assertEquals("fresh", body(response));
        assertEquals(1, upstream.calls.get());
    }

    @Test
    void testTransportErrorsAreRetriedWithBackoff() {
        upstream.enqueue(refused());
        upstream.enqueue(refused());
        upstream.enqueue(ok("recovered"));

        long start = System.nanoTime();
        ProxyResponse response = engine.handle(get("/other")).block();
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertNotNull(response);
        assertEquals("recovered", body(response));
        assertEquals(3, upstream.calls.get());
        // 10ms then 20ms
        assertTrue(elapsedMillis >= 30, "elapsed " + elapsedMillis + "ms");
    }

    @Test
    void testExhaustedTransportRetriesFail() {
        for (int i = 0; i < 3; i++) {
            upstream.enqueue(refused());
        }

        UpstreamUnavailableException e = assertThrows(UpstreamUnavailableException.class,
                () -> engine.handle(get("/other")).block());

        assertEquals(3, e.getAttempts());
        assertEquals(3, upstream.calls.get());
        assertTrue(cacheStore.entries.isEmpty());
    }

    @Test
    void testRetryableStatusExhaustionReturnsLastResponse() {
        for (int i = 0; i < 3; i++) {
            upstream.enqueue(status(HttpStatus.SERVICE_UNAVAILABLE));
        }

        ProxyResponse response = engine.handle(get("/other")).block();

        assertNotNull(response);
        assertEquals(503, response.getStatusCode());
        assertEquals(3, upstream.calls.get());
        assertTrue(cacheStore.entries.isEmpty());
    }

    @Test
    void testRetryableStatusThenSuccess() {
        upstream.enqueue(status(HttpStatus.BAD_GATEWAY));
        upstream.enqueue(ok("second"));

        ProxyResponse response = engine.handle(get("/other")).block();

        assertNotNull(response);
        assertEquals("second", body(response));
        assertEquals(2, upstream.calls.get());
        assertTrue(response.isStored());
    }

    @Test
    void testNonRetryableStatusIsNotRetried() {
        upstream.enqueue(status(HttpStatus.INTERNAL_SERVER_ERROR));

        ProxyResponse response = engine.handle(get("/other")).block();

        assertNotNull(response);
        assertEquals(500, response.getStatusCode());
        assertEquals(1, upstream.calls.get());
    }

    @Test
    void testRetryDisabledMakesSingleAttempt() {
        properties.getRetry().setEnabled(false);
        upstream.enqueue(status(HttpStatus.SERVICE_UNAVAILABLE));

        ProxyResponse response = engine.handle(get("/other")).block();
        assertNotNull(response);
        assertEquals(503, response.getStatusCode());
        assertEquals(1, upstream.calls.get());

        upstream.enqueue(refused());
        UpstreamUnavailableException e = assertThrows(UpstreamUnavailableException.class,
                () -> engine.handle(get("/other")).block());
        assertEquals(1, e.getAttempts());
        assertEquals(2, upstream.calls.get());
    }

    @Test
    void testBodyReadFailureIsNotRetried() {
        upstream.enqueue(Mono.just(ClientResponse.create(HttpStatus.OK)
                .body(Flux.<DataBuffer>error(new IOException("reset")))
                .build()));

        assertThrows(UpstreamBodyReadException.class, () -> engine.handle(get("/other")).block());
        assertEquals(1, upstream.calls.get());
    }

    @Test
    void testStalledBodyIsNotRetried() {
        upstream.enqueue(Mono.just(ClientResponse.create(HttpStatus.OK)
                .body(Flux.<DataBuffer>never())
                .build()));
        upstream.enqueue(ok("should not be reached"));
        ProxyRequest post = ProxyRequest.builder()
                .requestId("test")
                .method(HttpMethod.POST)
                .path("/items")
                .rawPath("/items")
                .body("payload".getBytes(StandardCharsets.UTF_8))
                .build();

        assertThrows(UpstreamBodyReadException.class, () -> engine.handle(post).block());
        assertEquals(1, upstream.calls.get());
    }

    @Test
    void testCancellationStopsRetrying() throws InterruptedException {
        properties.getRetry().setInitialBackoff(Duration.ofMillis(300));
        properties.getRetry().setMaxBackoff(Duration.ofSeconds(1));
        for (int i = 0; i < 3; i++) {
            upstream.enqueue(refused());
        }

        Disposable subscription = engine.handle(get("/other")).subscribe(r -> { }, e -> { });
        Thread.sleep(100);
        subscription.dispose();
        Thread.sleep(500);

        assertEquals(1, upstream.calls.get());
    }

    /**
     * Upstream that replays queued responses in order.
     */
    private static class StubUpstream implements ExchangeFunction {

        private final Deque<Mono<ClientResponse>> responses = new ArrayDeque<>();
        private final AtomicInteger calls = new AtomicInteger();
        private volatile ClientRequest lastRequest;

        synchronized void enqueue(Mono<ClientResponse> response) {
            responses.add(response);
        }

        @Override
        public synchronized Mono<ClientResponse> exchange(ClientRequest request) {
            calls.incrementAndGet();
            lastRequest = request;
            Mono<ClientResponse> next = responses.poll();
            return next != null ? next : Mono.error(new IllegalStateException("no stubbed response"));
        }
    }

    /**
     * Map-backed store with switchable failures.
     */
    private static class InMemoryCacheStore implements CacheStore {

        private final Map<String, CachedEntry> entries = new ConcurrentHashMap<>();
        private final Map<String, Duration> ttls = new ConcurrentHashMap<>();
        private final AtomicInteger getCalls = new AtomicInteger();
        private volatile boolean failGets;
        private volatile boolean failSets;

        @Override
        public Mono<CachedEntry> get(String key) {
            getCalls.incrementAndGet();
            if (failGets) {
                return Mono.error(new CacheStoreException("store down", new IOException("refused")));
            }
            return Mono.justOrEmpty(entries.get(key));
        }

        @Override
        public Mono<Void> set(String key, CachedEntry entry, Duration ttl) {
            if (failSets) {
                return Mono.error(new CacheStoreException("store down", new IOException("refused")));
            }
            entries.put(key, entry);
            ttls.put(key, ttl);
            return Mono.empty();
        }

        @Override
        public Mono<Boolean> delete(String key) {
            return Mono.just(entries.remove(key) != null);
        }

        @Override
        public Mono<Long> deleteByPrefix(String pattern) {
            long count = entries.size();
            entries.clear();
            return Mono.just(count);
        }
    }
}
