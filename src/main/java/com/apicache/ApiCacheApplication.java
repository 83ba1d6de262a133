package com.apicache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for api-cache - caching reverse proxy with per-path rate limiting.
 */
@SpringBootApplication
public class ApiCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiCacheApplication.class, args);
    }
}
