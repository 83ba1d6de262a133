package com.apicache.controller;

import com.apicache.model.ProxyRequest;
import com.apicache.model.ProxyResponse;
import com.apicache.service.ForwardingEngine;
import com.apicache.web.RequestIdWebFilter;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Catch-all proxy endpoint. Every path and method not claimed by another controller is
 * forwarded through the {@link ForwardingEngine}.
 */
@RestController
public class ProxyController {

    private final ForwardingEngine forwardingEngine;

    public ProxyController(ForwardingEngine forwardingEngine) {
        this.forwardingEngine = forwardingEngine;
    }

    @RequestMapping("/**")
    public Mono<ResponseEntity<byte[]>> proxy(ServerWebExchange exchange) {
        ServerHttpRequest request = exchange.getRequest();

        return readBody(request)
                .map(body -> ProxyRequest.builder()
                        .requestId(RequestIdWebFilter.requestId(exchange))
                        .method(request.getMethod())
                        .path(request.getURI().getPath())
                        .rawPath(request.getURI().getRawPath())
                        .rawQuery(request.getURI().getRawQuery())
                        .queryParams(request.getQueryParams())
                        .headers(request.getHeaders())
                        .body(body)
                        .build())
                .flatMap(forwardingEngine::handle)
                .map(ProxyController::toResponseEntity);
    }

    private static Mono<byte[]> readBody(ServerHttpRequest request) {
        return DataBufferUtils.join(request.getBody())
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .defaultIfEmpty(new byte[0]);
    }

    private static ResponseEntity<byte[]> toResponseEntity(ProxyResponse response) {
        HttpHeaders headers = new HttpHeaders();
        if (response.getHeaders() != null) {
            headers.addAll(response.getHeaders());
        }
        return ResponseEntity.status(response.getStatusCode())
                .headers(headers)
                .body(response.getBody());
    }
}
