package com.beacon.query.cache;

import java.time.Duration;

/**
 * Byte-oriented cache for series snapshots, addressed by keys from a
 * {@link CacheKeyGenerator}. Implementations own eviction and expiry and must
 * be safe for concurrent use by many query units.
 */
public interface QueryCache {
    
    /**
     * Look up the payload stored under the key.
     * 
     * @param key the cache key
     * @param allowStale whether an expired but still present entry may be returned
     * @return the payload and lookup status; never null
     * @throws CacheAccessException if the backing store cannot be reached
     */
    CacheRetrieval retrieve(String key, boolean allowStale);
    
    /**
     * Store the payload under the key for the given time to live.
     * 
     * @throws CacheAccessException if the backing store cannot be reached
     */
    void store(String key, byte[] data, Duration ttl);
    
    /**
     * Drop the entry stored under the key, if any
     */
    void remove(String key);
}
