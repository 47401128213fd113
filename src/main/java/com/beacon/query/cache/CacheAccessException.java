package com.beacon.query.cache;

/**
 * Reading from or writing to the query cache failed, or a cached payload
 * could not be decoded. Never fatal to a query: callers treat the cache as
 * empty and carry on.
 */
public class CacheAccessException extends RuntimeException {
    
    public CacheAccessException(String message) {
        super(message);
    }
    
    public CacheAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
