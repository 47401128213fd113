package com.beacon.storage;

import com.beacon.domain.Row;
import com.beacon.domain.Series;
import com.beacon.query.PromRangeQuery;
import com.beacon.storage.prom.PrometheusClient;
import com.beacon.storage.prom.PromQueryResult;
import com.beacon.storage.warm.ClickHouseRepository;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * {@link Reader} over ClickHouse for SQL and a Prometheus compatible HTTP
 * API for PromQL
 */
@Component
public class StorageReader implements Reader {
    
    private final ClickHouseRepository clickHouseRepository;
    private final PrometheusClient prometheusClient;
    
    public StorageReader(ClickHouseRepository clickHouseRepository, PrometheusClient prometheusClient) {
        this.clickHouseRepository = clickHouseRepository;
        this.prometheusClient = prometheusClient;
    }
    
    @Override
    public Mono<List<Series>> getTimeSeriesResult(String query) {
        return clickHouseRepository.queryTimeSeries(query);
    }
    
    @Override
    public Mono<PromQueryResult> getQueryRangeResult(PromRangeQuery query) {
        return prometheusClient.queryRange(query);
    }
    
    @Override
    public Mono<List<Row>> getListResult(String query) {
        return clickHouseRepository.queryRows(query);
    }
}
