package com.beacon.query;

import com.beacon.query.cache.CacheKeyGenerator;
import com.beacon.query.cache.QueryCache;
import com.beacon.query.cache.SeriesCodec;
import com.beacon.storage.Reader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.stream.Collectors;

/**
 * Wires the querier and its collaborators.
 * 
 * The query cache is optional: with beacon.cache.provider=none no
 * {@link QueryCache} bean exists and every sub-query is fetched in full.
 */
@Configuration
public class QuerierConfig {
    
    private static final Logger logger = LoggerFactory.getLogger(QuerierConfig.class);
    
    @Value("${beacon.querier.flux-interval:5m}")
    private Duration fluxInterval;
    
    @Value("${beacon.querier.cache-ttl:1h}")
    private Duration cacheTtl;
    
    @Value("${beacon.querier.query-timeout:30s}")
    private Duration queryTimeout;
    
    @Value("${beacon.querier.max-concurrent-queries:10}")
    private int maxConcurrentQueries;
    
    @Bean
    public Clock querierClock() {
        return Clock.systemUTC();
    }
    
    @Bean
    public TimeRangeReconciler timeRangeReconciler(Clock querierClock, SeriesCodec seriesCodec) {
        return new TimeRangeReconciler(fluxInterval, querierClock, seriesCodec);
    }
    
    @Bean
    public SeriesMerger seriesMerger() {
        return new SeriesMerger();
    }
    
    @Bean
    public ErrorExposurePolicy errorExposurePolicy() {
        return ErrorExposurePolicy.resourceLimitsOnly();
    }
    
    @Bean
    public QueryBuilder queryBuilder(ObjectProvider<QueryTranslator> translators) {
        return new QueryBuilder(translators.orderedStream().collect(Collectors.toList()));
    }
    
    @Bean
    public Querier querier(
            Reader reader,
            ObjectProvider<QueryCache> queryCache,
            CacheKeyGenerator cacheKeyGenerator,
            QueryBuilder queryBuilder,
            TimeRangeReconciler timeRangeReconciler,
            SeriesMerger seriesMerger,
            SeriesCodec seriesCodec,
            ErrorExposurePolicy errorExposurePolicy,
            QueryMetrics queryMetrics) {
        QueryCache cache = queryCache.getIfAvailable();
        if (cache == null) {
            logger.warn("No query cache configured, sub-queries are always fetched in full");
        }
        return new Querier(reader, cache, cacheKeyGenerator, queryBuilder, timeRangeReconciler,
            seriesMerger, seriesCodec, errorExposurePolicy, queryMetrics,
            new QuerierOptions(cacheTtl, queryTimeout, maxConcurrentQueries));
    }
}
