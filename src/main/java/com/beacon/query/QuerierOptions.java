package com.beacon.query;

import java.time.Duration;

/**
 * Tuning of the querier
 */
public final class QuerierOptions {
    
    private final Duration cacheTtl;
    private final Duration queryTimeout;
    private final int maxConcurrentQueries;
    
    /**
     * @param cacheTtl lifetime of a merged series snapshot in the cache
     * @param queryTimeout limit for one sub-query, cache lookups and all miss windows included
     * @param maxConcurrentQueries upper bound of sub-queries of one call running at once
     */
    public QuerierOptions(Duration cacheTtl, Duration queryTimeout, int maxConcurrentQueries) {
        if (maxConcurrentQueries < 1) {
            throw new IllegalArgumentException("maxConcurrentQueries must be at least 1");
        }
        this.cacheTtl = cacheTtl;
        this.queryTimeout = queryTimeout;
        this.maxConcurrentQueries = maxConcurrentQueries;
    }
    
    public Duration getCacheTtl() {
        return cacheTtl;
    }
    
    public Duration getQueryTimeout() {
        return queryTimeout;
    }
    
    public int getMaxConcurrentQueries() {
        return maxConcurrentQueries;
    }
}
