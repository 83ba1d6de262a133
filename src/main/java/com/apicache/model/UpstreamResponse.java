package com.apicache.model;

import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpHeaders;

/**
 * A fully read upstream response.
 */
@Value
@Builder
public class UpstreamResponse {

    int statusCode;

    HttpHeaders headers;

    byte[] body;

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
