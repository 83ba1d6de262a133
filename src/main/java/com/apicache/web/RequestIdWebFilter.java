package com.apicache.web;

import org.apache.commons.codec.binary.Hex;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.security.SecureRandom;

/**
 * Assigns every request an id: the inbound X-Request-ID if present, otherwise 16 random bytes
 * as hex. The id is echoed on the response and kept as an exchange attribute for log lines.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestIdWebFilter implements WebFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_ATTRIBUTE = RequestIdWebFilter.class.getName() + ".requestId";

    private static final SecureRandom RANDOM = new SecureRandom();

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String requestId = exchange.getRequest().getHeaders().getFirst(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = generateRequestId();
        }

        exchange.getAttributes().put(REQUEST_ID_ATTRIBUTE, requestId);
        exchange.getResponse().getHeaders().set(REQUEST_ID_HEADER, requestId);
        return chain.filter(exchange);
    }

    /**
     * Request id of the exchange, or an empty string when the filter did not run.
     */
    public static String requestId(ServerWebExchange exchange) {
        Object value = exchange.getAttribute(REQUEST_ID_ATTRIBUTE);
        return value != null ? value.toString() : "";
    }

    static String generateRequestId() {
        byte[] bytes = new byte[16];
        RANDOM.nextBytes(bytes);
        return Hex.encodeHexString(bytes);
    }
}
