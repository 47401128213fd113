package com.beacon.query;

import com.beacon.domain.QueryType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for QueryMetrics: per-type query counters, cache counters, latency
 * timer and result size distribution
 */
@DisplayName("QueryMetrics Tests")
class QueryMetricsTest {
    
    private QueryMetrics queryMetrics;
    private MeterRegistry meterRegistry;
    
    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        queryMetrics = new QueryMetrics();
        queryMetrics.meterRegistry = meterRegistry;
        queryMetrics.init();
    }
    
    @Test
    @DisplayName("Should register all meters on startup")
    void shouldInitializeAllMetrics() {
        assertThat(queryMetrics.getBuilderQueries()).isNotNull();
        assertThat(queryMetrics.getListQueries()).isNotNull();
        assertThat(queryMetrics.getPromQueries()).isNotNull();
        assertThat(queryMetrics.getClickHouseQueries()).isNotNull();
        assertThat(queryMetrics.getSubQueriesFailed()).isNotNull();
        assertThat(queryMetrics.getSubQueriesTimedOut()).isNotNull();
        assertThat(queryMetrics.getValidationFailures()).isNotNull();
        assertThat(queryMetrics.getCacheHits()).isNotNull();
        assertThat(queryMetrics.getCacheMisses()).isNotNull();
        assertThat(queryMetrics.getCacheStores()).isNotNull();
        assertThat(queryMetrics.getCacheStoreFailures()).isNotNull();
        assertThat(queryMetrics.getMissWindowsFetched()).isNotNull();
        assertThat(queryMetrics.getNegativeTimestampPoints()).isNotNull();
        assertThat(queryMetrics.getQueryRangeLatency()).isNotNull();
        assertThat(queryMetrics.getResultSize()).isNotNull();
        assertThat(meterRegistry.find("beacon.query.cache.hits").counter()).isNotNull();
    }
    
    @Test
    @DisplayName("Should count queries by type, list panels separately")
    void shouldCountQueriesByType() {
        queryMetrics.recordQueryRange(QueryType.BUILDER, false);
        queryMetrics.recordQueryRange(QueryType.BUILDER, true);
        queryMetrics.recordQueryRange(QueryType.BUILDER, true);
        queryMetrics.recordQueryRange(QueryType.PROMQL, false);
        queryMetrics.recordQueryRange(QueryType.CLICKHOUSE_SQL, false);
        
        assertThat(queryMetrics.getBuilderQueries().count()).isEqualTo(1.0);
        assertThat(queryMetrics.getListQueries().count()).isEqualTo(2.0);
        assertThat(queryMetrics.getPromQueries().count()).isEqualTo(1.0);
        assertThat(queryMetrics.getClickHouseQueries().count()).isEqualTo(1.0);
    }
    
    @Test
    @DisplayName("Should add up miss windows and negative timestamp points")
    void shouldAccumulateAmounts() {
        queryMetrics.recordMissWindowsFetched(2);
        queryMetrics.recordMissWindowsFetched(1);
        queryMetrics.recordNegativeTimestampPoints(5);
        
        assertThat(queryMetrics.getMissWindowsFetched().count()).isEqualTo(3.0);
        assertThat(queryMetrics.getNegativeTimestampPoints().count()).isEqualTo(5.0);
    }
    
    @Test
    @DisplayName("Should calculate cache hit rate")
    void shouldCalculateCacheHitRate() {
        assertThat(queryMetrics.getCacheHitRate()).isEqualTo(0.0);
        
        queryMetrics.recordCacheHit();
        queryMetrics.recordCacheHit();
        queryMetrics.recordCacheMiss();
        
        assertThat(queryMetrics.getCacheHitRate()).isCloseTo(66.67, within(0.01));
    }
    
    @Test
    @DisplayName("Should record query range latency")
    void shouldRecordLatency() {
        Timer.Sample sample = queryMetrics.startQueryRangeTimer();
        queryMetrics.recordQueryRangeLatency(sample);
        
        assertThat(queryMetrics.getQueryRangeLatency().count()).isEqualTo(1);
    }
    
    @Test
    @DisplayName("Should record result sizes")
    void shouldRecordResultSize() {
        queryMetrics.recordResultSize(3);
        queryMetrics.recordResultSize(1);
        
        assertThat(queryMetrics.getResultSize().count()).isEqualTo(2);
        assertThat(queryMetrics.getResultSize().totalAmount()).isEqualTo(4.0);
    }
}
