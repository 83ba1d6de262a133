package com.apicache.service;

import com.apicache.config.ApiCacheProperties;
import com.apicache.exception.UpstreamBodyReadException;
import com.apicache.model.ProxyRequest;
import com.apicache.model.UpstreamResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Makes a single upstream attempt: rewrites scheme/host to the upstream base URL and keeps the
 * method, path, query, headers and body. The response body is read fully.
 */
@Component
public class UpstreamClient {

    /**
     * Connection-scoped headers that are not forwarded in either direction.
     */
    private static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection", "keep-alive", "proxy-connection", "proxy-authenticate", "te", "trailer",
            "transfer-encoding", "upgrade", "host", "content-length");

    private static final byte[] EMPTY_BODY = new byte[0];

    private final WebClient webClient;
    private final String baseUrl;
    private final Duration timeout;

    public UpstreamClient(WebClient webClient, ApiCacheProperties properties) {
        this.webClient = webClient;
        this.baseUrl = stripTrailingSlash(properties.getUpstream().getBaseUrl());
        this.timeout = properties.getUpstream().getTimeout();
    }

    /**
     * Execute one upstream attempt.
     *
     * @param request inbound request
     * @return upstream response; errors with {@link UpstreamBodyReadException} if the body cannot
     *         be read, or with a transport error (see {@link #isTransportFault(Throwable)})
     */
    public Mono<UpstreamResponse> exchange(ProxyRequest request) {
        URI uri = buildUri(request);

        WebClient.RequestBodySpec spec = webClient.method(request.getMethod())
                .uri(uri)
                .headers(headers -> copyHeaders(request.getHeaders(), headers));

        WebClient.RequestHeadersSpec<?> ready = request.getBody().length > 0
                ? spec.bodyValue(request.getBody())
                : spec;

        return ready.exchangeToMono(this::readResponse);
    }

    /**
     * Connection refused, reset, DNS failure, or no response within the response timeout
     * ({@code HttpClient.responseTimeout}). These are worth retrying.
     */
    public static boolean isTransportFault(Throwable error) {
        return error instanceof WebClientRequestException || error instanceof TimeoutException;
    }

    public URI buildUri(ProxyRequest request) {
        StringBuilder url = new StringBuilder(baseUrl).append(request.getRawPath());
        if (request.getRawQuery() != null && !request.getRawQuery().isEmpty()) {
            url.append('?').append(request.getRawQuery());
        }
        return URI.create(url.toString());
    }

    private Mono<UpstreamResponse> readResponse(ClientResponse response) {
        int status = response.statusCode().value();
        HttpHeaders headers = new HttpHeaders();
        copyHeaders(response.headers().asHttpHeaders(), headers);

        // After the status line, a stalled or broken body is a read failure
        return response.bodyToMono(byte[].class)
                .timeout(timeout)
                .defaultIfEmpty(EMPTY_BODY)
                .onErrorMap(e -> new UpstreamBodyReadException("failed to read upstream response body", e))
                .map(body -> UpstreamResponse.builder()
                        .statusCode(status)
                        .headers(headers)
                        .body(body)
                        .build());
    }

    private static void copyHeaders(HttpHeaders source, HttpHeaders target) {
        source.forEach((name, values) -> {
            if (!HOP_BY_HOP_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                target.addAll(name, values);
            }
        });
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
