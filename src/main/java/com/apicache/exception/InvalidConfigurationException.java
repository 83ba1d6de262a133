package com.apicache.exception;

/**
 * Thrown while building the endpoint rule table when the configuration cannot be served.
 * Raised during bean creation, so the application refuses to start.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
