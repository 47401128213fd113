package com.beacon.query;

import com.beacon.domain.QueryType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.annotation.PostConstruct;
import java.time.Duration;

/**
 * Metrics collector for query range execution.
 * Tracks requests per query type, sub-query failures, cache effectiveness,
 * fetched miss windows and data quality of backend results.
 */
@Component
public class QueryMetrics {
    
    @Autowired
    MeterRegistry meterRegistry;
    
    private Counter builderQueries;
    private Counter listQueries;
    private Counter promQueries;
    private Counter clickHouseQueries;
    private Counter subQueriesFailed;
    private Counter subQueriesTimedOut;
    private Counter validationFailures;
    private Counter cacheHits;
    private Counter cacheMisses;
    private Counter cacheStores;
    private Counter cacheStoreFailures;
    private Counter missWindowsFetched;
    private Counter negativeTimestampPoints;
    private Timer queryRangeLatency;
    private DistributionSummary resultSize;
    
    @PostConstruct
    public void init() {
        builderQueries = Counter.builder("beacon.query.builder")
            .description("Total number of builder query range requests")
            .register(meterRegistry);
        
        listQueries = Counter.builder("beacon.query.list")
            .description("Total number of builder list/trace query range requests")
            .register(meterRegistry);
        
        promQueries = Counter.builder("beacon.query.promql")
            .description("Total number of PromQL query range requests")
            .register(meterRegistry);
        
        clickHouseQueries = Counter.builder("beacon.query.clickhouse")
            .description("Total number of raw ClickHouse SQL query range requests")
            .register(meterRegistry);
        
        subQueriesFailed = Counter.builder("beacon.query.subquery.failed")
            .description("Total number of sub-queries that failed")
            .register(meterRegistry);
        
        subQueriesTimedOut = Counter.builder("beacon.query.subquery.timedout")
            .description("Total number of sub-queries that timed out")
            .register(meterRegistry);
        
        validationFailures = Counter.builder("beacon.query.validation.failures")
            .description("Total number of requests rejected by panel validation")
            .register(meterRegistry);
        
        cacheHits = Counter.builder("beacon.query.cache.hits")
            .description("Total number of cache lookups that returned data")
            .register(meterRegistry);
        
        cacheMisses = Counter.builder("beacon.query.cache.misses")
            .description("Total number of cache lookups that returned no data")
            .register(meterRegistry);
        
        cacheStores = Counter.builder("beacon.query.cache.stores")
            .description("Total number of merged series snapshots written to the cache")
            .register(meterRegistry);
        
        cacheStoreFailures = Counter.builder("beacon.query.cache.store.failures")
            .description("Total number of failed cache writes")
            .register(meterRegistry);
        
        missWindowsFetched = Counter.builder("beacon.query.miss.windows")
            .description("Total number of miss windows fetched from the backend")
            .register(meterRegistry);
        
        negativeTimestampPoints = Counter.builder("beacon.query.points.negative.timestamp")
            .description("Total number of points dropped for having a negative timestamp")
            .register(meterRegistry);
        
        queryRangeLatency = Timer.builder("beacon.query.range.latency")
            .description("Latency of query range requests")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofMillis(10))
            .maximumExpectedValue(Duration.ofSeconds(60))
            .register(meterRegistry);
        
        resultSize = DistributionSummary.builder("beacon.query.result.size")
            .description("Distribution of the number of results per query range request")
            .baseUnit("results")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);
    }
    
    public void recordQueryRange(QueryType queryType, boolean rowOriented) {
        switch (queryType) {
            case BUILDER -> {
                if (rowOriented) {
                    listQueries.increment();
                } else {
                    builderQueries.increment();
                }
            }
            case PROMQL -> promQueries.increment();
            case CLICKHOUSE_SQL -> clickHouseQueries.increment();
        }
    }
    
    public void recordSubQueryFailed() {
        subQueriesFailed.increment();
    }
    
    public void recordSubQueryTimedOut() {
        subQueriesTimedOut.increment();
    }
    
    public void recordValidationFailure() {
        validationFailures.increment();
    }
    
    public void recordCacheHit() {
        cacheHits.increment();
    }
    
    public void recordCacheMiss() {
        cacheMisses.increment();
    }
    
    public void recordCacheStore() {
        cacheStores.increment();
    }
    
    public void recordCacheStoreFailure() {
        cacheStoreFailures.increment();
    }
    
    public void recordMissWindowsFetched(int windows) {
        missWindowsFetched.increment(windows);
    }
    
    public void recordNegativeTimestampPoints(int points) {
        negativeTimestampPoints.increment(points);
    }
    
    public void recordResultSize(int results) {
        resultSize.record(results);
    }
    
    public Timer.Sample startQueryRangeTimer() {
        return Timer.start(meterRegistry);
    }
    
    public void recordQueryRangeLatency(Timer.Sample sample) {
        sample.stop(queryRangeLatency);
    }
    
    /**
     * Cache hit rate as a percentage, 0 if the cache was never consulted
     */
    public double getCacheHitRate() {
        double hits = cacheHits.count();
        double misses = cacheMisses.count();
        double total = hits + misses;
        
        if (total == 0) {
            return 0.0;
        }
        
        return (hits / total) * 100.0;
    }
    
    // Getter methods for testing
    public Counter getBuilderQueries() {
        return builderQueries;
    }
    
    public Counter getListQueries() {
        return listQueries;
    }
    
    public Counter getPromQueries() {
        return promQueries;
    }
    
    public Counter getClickHouseQueries() {
        return clickHouseQueries;
    }
    
    public Counter getSubQueriesFailed() {
        return subQueriesFailed;
    }
    
    public Counter getSubQueriesTimedOut() {
        return subQueriesTimedOut;
    }
    
    public Counter getValidationFailures() {
        return validationFailures;
    }
    
    public Counter getCacheHits() {
        return cacheHits;
    }
    
    public Counter getCacheMisses() {
        return cacheMisses;
    }
    
    public Counter getCacheStores() {
        return cacheStores;
    }
    
    public Counter getCacheStoreFailures() {
        return cacheStoreFailures;
    }
    
    public Counter getMissWindowsFetched() {
        return missWindowsFetched;
    }
    
    public Counter getNegativeTimestampPoints() {
        return negativeTimestampPoints;
    }
    
    public Timer getQueryRangeLatency() {
        return queryRangeLatency;
    }
    
    public DistributionSummary getResultSize() {
        return resultSize;
    }
}
