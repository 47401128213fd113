package com.beacon.storage;

import com.beacon.domain.Row;
import com.beacon.domain.Series;
import com.beacon.query.PromRangeQuery;
import com.beacon.storage.prom.PromQueryResult;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Executes queries against the backing stores. Shared by all query units of
 * all requests, so implementations must be safe for concurrent use.
 * Cancelling a returned Mono cancels the backend call.
 */
public interface Reader {
    
    /**
     * Run ClickHouse SQL returning time series rows and group them into series
     */
    Mono<List<Series>> getTimeSeriesResult(String query);
    
    /**
     * Run a PromQL range query
     */
    Mono<PromQueryResult> getQueryRangeResult(PromRangeQuery query);
    
    /**
     * Run ClickHouse SQL returning raw rows for list and trace panels
     */
    Mono<List<Row>> getListResult(String query);
}
