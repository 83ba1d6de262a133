package com.apicache.controller;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness endpoint. Never rate limited, never cached, never forwarded.
 */
@RestController
public class HealthController {

    static final String SERVICE_NAME = "api-cache";

    @RequestMapping("/health")
    public HealthStatus health() {
        return new HealthStatus("healthy", SERVICE_NAME);
    }

    @Value
    @JsonPropertyOrder({"status", "service"})
    public static class HealthStatus {
        String status;
        String service;
    }
}
