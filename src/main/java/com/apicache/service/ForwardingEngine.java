package com.apicache.service;

import com.apicache.config.ApiCacheProperties;
import com.apicache.exception.UpstreamUnavailableException;
import com.apicache.model.CacheHeaders;
import com.apicache.model.CachedEntry;
import com.apicache.model.ProxyRequest;
import com.apicache.model.ProxyResponse;
import com.apicache.model.UpstreamResponse;
import com.apicache.repository.CacheStore;
import com.apicache.rules.CacheRule;
import com.apicache.rules.EndpointResolver;
import com.apicache.rules.MatchResult;
import com.apicache.web.QuerySanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestrates a proxied request: cache lookup for GET, upstream forwarding with retry,
 * and cache population for successful GET responses.
 *
 * <p>The cache store is best effort. Lookup failures are treated as misses and write
 * failures are logged; neither reaches the client.
 */
@Slf4j
@Service
public class ForwardingEngine {

    private final ApiCacheProperties properties;
    private final EndpointResolver endpointResolver;
    private final CacheKeyGenerator keyGenerator;
    private final CacheStore cacheStore;
    private final UpstreamClient upstreamClient;
    private final QuerySanitizer querySanitizer;

    public ForwardingEngine(ApiCacheProperties properties,
                            EndpointResolver endpointResolver,
                            CacheKeyGenerator keyGenerator,
                            CacheStore cacheStore,
                            UpstreamClient upstreamClient,
                            QuerySanitizer querySanitizer) {
        this.properties = properties;
        this.endpointResolver = endpointResolver;
        this.keyGenerator = keyGenerator;
        this.cacheStore = cacheStore;
        this.upstreamClient = upstreamClient;
        this.querySanitizer = querySanitizer;
    }

    /**
     * Handle one inbound request.
     *
     * @param request buffered inbound request
     * @return response to relay; errors with {@link UpstreamUnavailableException} when the
     *         upstream stayed unreachable, or with an upstream body read failure
     */
    public Mono<ProxyResponse> handle(ProxyRequest request) {
        long startNanos = System.nanoTime();
        log.info("Incoming request: requestId={}, method={}, path={}, query={}",
                request.getRequestId(), request.getMethod(), request.getPath(),
                querySanitizer.sanitize(request.getRawQuery()));

        if (!request.isGet()) {
            return forward(request)
                    .map(response -> ProxyResponse.builder()
                            .statusCode(response.getStatusCode())
                            .headers(response.getHeaders())
                            .body(response.getBody())
                            .build())
                    .doOnNext(response -> logForwarded(request, response, startNanos));
        }

        MatchResult match = endpointResolver.resolveCache(
                request.getPath(), request.getMethod().name(), request.getQueryParams());
        CacheRule rule = match.getRule();
        String key = keyGenerator.generateKey(request.getMethod().name(), request.getPath(),
                request.getQueryParams(), request.getHeaders(), rule);
        Duration ttl = resolveTtl(rule);

        log.debug("Cache key generated: requestId={}, key={}, rule={}, matchType={}, ttl={}s",
                request.getRequestId(), key, rule != null ? rule.identifier() : "none",
                match.getKind().getLabel(), ttl.toSeconds());

        return lookup(request, key)
                .map(entry -> serveFromCache(request, key, entry, startNanos))
                .switchIfEmpty(Mono.defer(() -> forwardAndCache(request, key, ttl, startNanos)));
    }

    /**
     * Forward to upstream with retry on transport faults and retryable status codes.
     *
     * <p>A retryable status on the final attempt is returned as is. Transport faults on the
     * final attempt become {@link UpstreamUnavailableException}. Anything else fails at once.
     */
    public Mono<UpstreamResponse> forward(ProxyRequest request) {
        ApiCacheProperties.RetryConfig retry = properties.getRetry();
        int maxAttempts = retry.isEnabled() ? retry.getMaxAttempts() : 1;

        return Mono.defer(() -> {
            RetryState state = new RetryState(maxAttempts, retry.getInitialBackoff(),
                    retry.getMaxBackoff(), retry.getBackoffMultiplier());

            return Mono.defer(() -> attempt(request, state))
                    .retryWhen(Retry.from(signals -> signals.concatMap(
                            signal -> backoffOrGiveUp(request, state, signal.failure()))));
        });
    }

    private Mono<UpstreamResponse> attempt(ProxyRequest request, RetryState state) {
        state.recordAttempt();
        log.debug("Attempting upstream request: requestId={}, attempt={}/{}",
                request.getRequestId(), state.getAttempt(), state.getMaxAttempts());

        return upstreamClient.exchange(request)
                .flatMap(response -> {
                    if (isRetryableStatus(response.getStatusCode()) && state.hasAttemptsLeft()) {
                        return Mono.error(new RetryableStatusException(response.getStatusCode()));
                    }
                    if (state.getAttempt() > 1) {
                        log.info("Request succeeded after retry: requestId={}, attempt={}, statusCode={}",
                                request.getRequestId(), state.getAttempt(), response.getStatusCode());
                    }
                    return Mono.just(response);
                });
    }

    private Mono<Long> backoffOrGiveUp(ProxyRequest request, RetryState state, Throwable failure) {
        if (failure instanceof RetryableStatusException) {
            Duration delay = state.advance(failure);
            log.warn("Retryable status code, retrying: requestId={}, attempt={}, statusCode={}, backoff={}ms",
                    request.getRequestId(), state.getAttempt(),
                    ((RetryableStatusException) failure).getStatusCode(), delay.toMillis());
            return Mono.delay(delay);
        }

        if (!UpstreamClient.isTransportFault(failure)) {
            return Mono.error(failure);
        }

        if (!state.hasAttemptsLeft()) {
            log.error("All retry attempts exhausted: requestId={}, attempts={}, error={}",
                    request.getRequestId(), state.getAttempt(), failure.toString());
            return Mono.error(new UpstreamUnavailableException(state.getAttempt(), failure));
        }

        Duration delay = state.advance(failure);
        log.warn("Request failed, retrying: requestId={}, attempt={}, error={}, backoff={}ms",
                request.getRequestId(), state.getAttempt(), failure.toString(), delay.toMillis());
        return Mono.delay(delay);
    }

    private boolean isRetryableStatus(int statusCode) {
        ApiCacheProperties.RetryConfig retry = properties.getRetry();
        return retry.isEnabled() && retry.getRetryableStatusCodes().contains(statusCode);
    }

    private Mono<CachedEntry> lookup(ProxyRequest request, String key) {
        return cacheStore.get(key)
                .filter(entry -> {
                    if (isWellFormed(entry)) {
                        return true;
                    }
                    log.warn("Ignoring malformed cache entry: requestId={}, key={}", request.getRequestId(), key);
                    return false;
                })
                .onErrorResume(e -> {
                    log.error("Failed to get from cache: requestId={}, key={}, error={}",
                            request.getRequestId(), key, e.getMessage());
                    return Mono.empty();
                });
    }

    private ProxyResponse serveFromCache(ProxyRequest request, String key, CachedEntry entry, long startNanos) {
        HttpHeaders headers = new HttpHeaders();
        entry.getHeaders().forEach(headers::addAll);
        headers.set(CacheHeaders.X_CACHE, CacheHeaders.HIT);
        headers.set(CacheHeaders.X_CACHE_TIME, formatCacheTime(entry.getCachedAt()));

        log.info("Cache hit: requestId={}, key={}, statusCode={}, cachedAt={}, durationMs={}",
                request.getRequestId(), key, entry.getStatusCode(), entry.getCachedAt(), elapsedMillis(startNanos));

        return ProxyResponse.builder()
                .statusCode(entry.getStatusCode())
                .headers(headers)
                .body(entry.getBody() != null ? entry.getBody() : new byte[0])
                .cacheStatus(CacheHeaders.HIT)
                .build();
    }

    private Mono<ProxyResponse> forwardAndCache(ProxyRequest request, String key, Duration ttl, long startNanos) {
        log.debug("Cache miss: requestId={}, key={}", request.getRequestId(), key);

        return forward(request)
                .flatMap(response -> {
                    if (!response.isSuccessful()) {
                        log.debug("Response not cached: requestId={}, statusCode={}",
                                request.getRequestId(), response.getStatusCode());
                        return Mono.just(miss(response, false));
                    }

                    CachedEntry entry = CachedEntry.builder()
                            .statusCode(response.getStatusCode())
                            .headers(copyHeaders(response.getHeaders()))
                            .body(response.getBody())
                            .cachedAt(Instant.now())
                            .build();

                    return cacheStore.set(key, entry, ttl)
                            .thenReturn(true)
                            .doOnNext(stored -> log.debug("Response cached: requestId={}, key={}, ttl={}s",
                                    request.getRequestId(), key, ttl.toSeconds()))
                            .onErrorResume(e -> {
                                log.error("Failed to cache response: requestId={}, key={}, error={}",
                                        request.getRequestId(), key, e.getMessage());
                                return Mono.just(false);
                            })
                            .map(stored -> miss(response, stored));
                })
                .doOnNext(response -> logForwarded(request, response, startNanos));
    }

    private ProxyResponse miss(UpstreamResponse response, boolean stored) {
        HttpHeaders headers = new HttpHeaders();
        headers.addAll(response.getHeaders());
        headers.set(CacheHeaders.X_CACHE, CacheHeaders.MISS);

        return ProxyResponse.builder()
                .statusCode(response.getStatusCode())
                .headers(headers)
                .body(response.getBody())
                .cacheStatus(CacheHeaders.MISS)
                .stored(stored)
                .build();
    }

    private Duration resolveTtl(CacheRule rule) {
        if (rule != null && rule.hasPositiveTtl()) {
            return rule.getTtl();
        }
        return properties.getCache().getDefaultTtl();
    }

    private void logForwarded(ProxyRequest request, ProxyResponse response, long startNanos) {
        log.info("Request forwarded to upstream: requestId={}, method={}, path={}, query={}, statusCode={}, cache={}, bodySize={}, durationMs={}",
                request.getRequestId(), request.getMethod(), request.getPath(),
                querySanitizer.sanitize(request.getRawQuery()), response.getStatusCode(),
                response.getCacheStatus() != null ? response.getCacheStatus() : "-",
                response.getBody() != null ? response.getBody().length : 0, elapsedMillis(startNanos));
    }

    private static boolean isWellFormed(CachedEntry entry) {
        return entry.getStatusCode() >= 100 && entry.getStatusCode() <= 599
                && entry.getHeaders() != null && entry.getCachedAt() != null;
    }

    private static Map<String, List<String>> copyHeaders(HttpHeaders headers) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        headers.forEach((name, values) -> copy.put(name, new ArrayList<>(values)));
        return copy;
    }

    /**
     * RFC 3339, second precision, UTC.
     */
    static String formatCacheTime(Instant cachedAt) {
        return DateTimeFormatter.ISO_INSTANT.format(cachedAt.truncatedTo(ChronoUnit.SECONDS));
    }

    private static long elapsedMillis(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    /**
     * Signals a retryable upstream status while attempts remain. Never leaves this class.
     */
    static final class RetryableStatusException extends RuntimeException {

        private final int statusCode;

        RetryableStatusException(int statusCode) {
            super("retryable upstream status " + statusCode, null, false, false);
            this.statusCode = statusCode;
        }

        int getStatusCode() {
            return statusCode;
        }
    }
}
