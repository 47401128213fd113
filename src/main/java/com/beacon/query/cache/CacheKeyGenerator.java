package com.beacon.query.cache;

import com.beacon.domain.QueryRangeParams;

import java.util.Map;

/**
 * Derives cache keys for the sub-queries of a request. A sub-query without
 * a key is not cached.
 */
@FunctionalInterface
public interface CacheKeyGenerator {
    
    Map<String, String> generateKeys(QueryRangeParams params);
}
