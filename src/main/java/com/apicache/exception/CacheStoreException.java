package com.apicache.exception;

/**
 * Cache backend fault: store unreachable, or an entry that cannot be encoded/decoded.
 * Always recovered locally; never reaches the client.
 */
public class CacheStoreException extends RuntimeException {

    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
