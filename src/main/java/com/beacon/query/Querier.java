package com.beacon.query;

import com.beacon.domain.AttributeKey;
import com.beacon.domain.BuilderQuery;
import com.beacon.domain.ClickHouseQuery;
import com.beacon.domain.CompositeQuery;
import com.beacon.domain.DataSource;
import com.beacon.domain.PanelType;
import com.beacon.domain.Point;
import com.beacon.domain.PromQuery;
import com.beacon.domain.QueryRangeParams;
import com.beacon.domain.QueryResult;
import com.beacon.domain.Series;
import com.beacon.query.cache.CacheAccessException;
import com.beacon.query.cache.CacheKeyGenerator;
import com.beacon.query.cache.CacheRetrieval;
import com.beacon.query.cache.QueryCache;
import com.beacon.query.cache.SeriesCodec;
import com.beacon.storage.Reader;
import com.beacon.storage.prom.PromSampleStream;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Querier answers query range requests for dashboards and alerts.
 *
 * A request carries a composite query of one query type. The querier:
 * - Dispatches on query type and panel type
 * - Fans out the sub-queries concurrently, with at most the configured
 *   number of sub-queries in flight
 * - Serves metrics builder and PromQL sub-queries from the series cache,
 *   fetching only the windows the cache does not cover
 * - Collects per-sub-query results and errors, so one failing sub-query
 *   does not take down the others
 *
 * The querier holds no per-request state and is shared by all requests.
 */
public class Querier {

    private static final Logger log = LoggerFactory.getLogger(Querier.class);
    private static final byte[] NO_CACHED_DATA = new byte[0];

    private final Reader reader;
    private final QueryCache cache;
    private final CacheKeyGenerator keyGenerator;
    private final QueryBuilder queryBuilder;
    private final TimeRangeReconciler reconciler;
    private final SeriesMerger merger;
    private final SeriesCodec codec;
    private final ErrorExposurePolicy errorExposurePolicy;
    private final QueryMetrics metrics;
    private final QuerierOptions options;

    /**
     * @param cache series cache, or null to run without caching
     */
    public Querier(
            Reader reader,
            QueryCache cache,
            CacheKeyGenerator keyGenerator,
            QueryBuilder queryBuilder,
            TimeRangeReconciler reconciler,
            SeriesMerger merger,
            SeriesCodec codec,
            ErrorExposurePolicy errorExposurePolicy,
            QueryMetrics metrics,
            QuerierOptions options) {
        this.reader = reader;
        this.cache = cache;
        this.keyGenerator = keyGenerator;
        this.queryBuilder = queryBuilder;
        this.reconciler = reconciler;
        this.merger = merger;
        this.codec = codec;
        this.errorExposurePolicy = errorExposurePolicy;
        this.metrics = metrics;
        this.options = options;

        log.info("Querier initialized with cache={}, cacheTtl={}, queryTimeout={}, maxConcurrentQueries={}",
            cache != null ? cache.getClass().getSimpleName() : "none",
            options.getCacheTtl(), options.getQueryTimeout(), options.getMaxConcurrentQueries());
    }

    /**
     * Run every enabled sub-query of the request.
     *
     * The returned Mono always completes with a response; failures are
     * reported through {@link QueryRangeResponse#getError()} and
     * {@link QueryRangeResponse#getErrorsByName()}. Cancelling it cancels all
     * in-flight sub-queries.
     *
     * @param params request window, step and composite query
     * @param attributeKeys attribute metadata used by builder query translation
     */
    public Mono<QueryRangeResponse> queryRange(QueryRangeParams params, Map<String, AttributeKey> attributeKeys) {
        CompositeQuery compositeQuery = params.getCompositeQuery();
        if (compositeQuery == null || compositeQuery.getQueryType() == null) {
            log.warn("Rejecting query range request without a valid query type");
            return Mono.just(QueryRangeResponse.failed(new QueryExecutionException("invalid query type")));
        }

        PanelType panelType = compositeQuery.getPanelType();
        boolean listQuery = panelType != null && panelType.isRowOriented();
        Timer.Sample sample = metrics.startQueryRangeTimer();
        metrics.recordQueryRange(compositeQuery.getQueryType(), listQuery);

        log.debug("Query range: type={}, panel={}, start={}, end={}, step={}, noCache={}",
            compositeQuery.getQueryType(), panelType, params.getStart(), params.getEnd(),
            params.getStep(), params.isNoCache());

        Mono<QueryRangeResponse> response = switch (compositeQuery.getQueryType()) {
            case BUILDER -> listQuery
                ? runBuilderListQueries(params, attributeKeys)
                : runBuilderQueries(params, attributeKeys);
            case PROMQL -> runPromQueries(params);
            case CLICKHOUSE_SQL -> runClickHouseQueries(params);
        };

        return response
            .map(result -> validatePanel(compositeQuery, result))
            .doOnNext(result -> metrics.recordResultSize(result.getResults().size()))
            .doFinally(signal -> metrics.recordQueryRangeLatency(sample));
    }

    // ========== Builder Queries ==========

    private Mono<QueryRangeResponse> runBuilderQueries(QueryRangeParams params, Map<String, AttributeKey> attributeKeys) {
        Map<String, String> cacheKeys = keyGenerator.generateKeys(params);

        List<QueryUnit> units = new ArrayList<>();
        for (Map.Entry<String, BuilderQuery> entry : params.getCompositeQuery().getBuilderQueries().entrySet()) {
            String queryName = entry.getKey();
            BuilderQuery query = entry.getValue();
            if (!queryName.equals(query.getExpression()) || query.isDisabled()) {
                continue;
            }
            units.add(new QueryUnit(queryName, null,
                () -> runBuilderQuery(queryName, query, params, attributeKeys, cacheKeys)));
        }

        return fanOut(units)
            .map(outcomes -> collect(outcomes, "builder").filterErrors(errorExposurePolicy));
    }

    private Mono<QueryOutcome> runBuilderQuery(String queryName, BuilderQuery query, QueryRangeParams params,
                                               Map<String, AttributeKey> attributeKeys, Map<String, String> cacheKeys) {
        long start = params.getStart();
        long end = params.getEnd();
        if (query.getShiftBy() != 0) {
            start -= query.getShiftBy() * 1000;
            end -= query.getShiftBy() * 1000;
        }

        String cacheKey = cacheKeys.get(queryName);
        if (query.getDataSource() != DataSource.METRICS || cacheKey == null) {
            String sql = queryBuilder.prepareQuery(start, end, params, query, attributeKeys);
            return execClickHouseQuery(sql)
                .map(series -> QueryOutcome.series(queryName, sql, series));
        }

        long windowStart = start;
        long windowEnd = end;
        return runCachedQuery(queryName, cacheKey, params.isNoCache(), windowStart, windowEnd, query.getStepInterval(),
                miss -> execClickHouseQuery(
                    queryBuilder.prepareQuery(miss.getStart(), miss.getEnd(), params, query, attributeKeys)))
            .map(series -> QueryOutcome.series(queryName, null, filterCachedPoints(series, windowStart, windowEnd)));
    }

    /**
     * List and trace panels: every query is translated up front, any failure
     * fails the whole request and no partial results are returned.
     */
    private Mono<QueryRangeResponse> runBuilderListQueries(QueryRangeParams params,
                                                           Map<String, AttributeKey> attributeKeys) {
        Map<String, String> queries;
        try {
            queries = queryBuilder.prepareQueries(params, attributeKeys);
        } catch (TranslationException e) {
            log.error("Failed to prepare list queries: {}", e.getMessage());
            return Mono.just(QueryRangeResponse.failed(e));
        }

        List<QueryUnit> units = new ArrayList<>();
        queries.forEach((queryName, sql) -> units.add(new QueryUnit(queryName, sql,
            () -> reader.getListResult(sql).map(rows -> QueryOutcome.rows(queryName, sql, rows)))));

        return fanOut(units).map(this::collectList);
    }

    private QueryRangeResponse collectList(List<QueryOutcome> outcomes) {
        List<QueryResult> results = new ArrayList<>();
        Map<String, Throwable> errorsByName = new LinkedHashMap<>();
        List<Throwable> failures = new ArrayList<>();

        for (QueryOutcome outcome : outcomes) {
            if (outcome.getKind() == QueryOutcome.Kind.FAILED) {
                Throwable failure = new QueryExecutionException(
                    "error in query-" + outcome.getQueryName() + ": " + outcome.getError().getMessage(),
                    outcome.getQueryName(), outcome.getQuery(), outcome.getError());
                errorsByName.put(outcome.getQueryName(), failure);
                failures.add(failure);
            } else {
                results.add(outcome.toResult());
            }
        }

        if (failures.isEmpty()) {
            return new QueryRangeResponse(results, errorsByName, null);
        }

        StringBuilder message = new StringBuilder("encountered multiple errors: ");
        for (int i = 0; i < failures.size(); i++) {
            if (i > 0) {
                message.append("; ");
            }
            message.append(failures.get(i).getMessage());
        }
        QueryExecutionException error = new QueryExecutionException(message.toString());
        failures.forEach(error::addSuppressed);
        return new QueryRangeResponse(Collections.emptyList(), errorsByName, error);
    }

    // ========== PromQL Queries ==========

    private Mono<QueryRangeResponse> runPromQueries(QueryRangeParams params) {
        Map<String, String> cacheKeys = keyGenerator.generateKeys(params);

        List<QueryUnit> units = new ArrayList<>();
        for (Map.Entry<String, PromQuery> entry : params.getCompositeQuery().getPromQueries().entrySet()) {
            String queryName = entry.getKey();
            PromQuery promQuery = entry.getValue();
            if (promQuery.isDisabled()) {
                continue;
            }
            units.add(new QueryUnit(queryName, promQuery.getQuery(),
                () -> runCachedQuery(queryName, cacheKeys.get(queryName), params.isNoCache(),
                        params.getStart(), params.getEnd(), params.getStep(),
                        miss -> execPromQuery(PromRangeQuery.of(promQuery, params.getStep(), miss.getStart(), miss.getEnd())))
                    .map(series -> QueryOutcome.series(queryName, promQuery.getQuery(), series))));
        }

        return fanOut(units).map(outcomes -> collect(outcomes, "prom"));
    }

    private Mono<List<Series>> execPromQuery(PromRangeQuery query) {
        return reader.getQueryRangeResult(query).map(result -> {
            List<Series> series = new ArrayList<>();
            for (PromSampleStream stream : result.matrix()) {
                series.add(new Series(stream.getMetric(), stream.getPoints()));
            }
            return series;
        });
    }

    // ========== ClickHouse Queries ==========

    private Mono<QueryRangeResponse> runClickHouseQueries(QueryRangeParams params) {
        List<QueryUnit> units = new ArrayList<>();
        for (Map.Entry<String, ClickHouseQuery> entry : params.getCompositeQuery().getClickHouseQueries().entrySet()) {
            String queryName = entry.getKey();
            ClickHouseQuery query = entry.getValue();
            if (query.isDisabled()) {
                continue;
            }
            units.add(new QueryUnit(queryName, query.getQuery(),
                () -> execClickHouseQuery(query.getQuery())
                    .map(series -> QueryOutcome.series(queryName, query.getQuery(), series))));
        }

        return fanOut(units).map(outcomes -> collect(outcomes, "clickhouse"));
    }

    private Mono<List<Series>> execClickHouseQuery(String query) {
        return reader.getTimeSeriesResult(query).map(series -> dropNegativeTimestamps(query, series));
    }

    /**
     * Points before the epoch come from broken ingestion and are never returned
     */
    private List<Series> dropNegativeTimestamps(String query, List<Series> seriesList) {
        int dropped = 0;
        List<Series> filtered = new ArrayList<>(seriesList.size());
        for (Series series : seriesList) {
            List<Point> points = new ArrayList<>(series.getPoints().size());
            for (Point point : series.getPoints()) {
                if (point.getTimestamp() >= 0) {
                    points.add(point);
                } else {
                    dropped++;
                }
            }
            Series copy = series.copy();
            copy.setPoints(points);
            filtered.add(copy);
        }

        if (dropped > 0) {
            log.error("Dropped {} points with negative timestamps for query: {}", dropped, query);
            metrics.recordNegativeTimestampPoints(dropped);
        }
        return filtered;
    }

    // ========== Cache Pipeline ==========

    /**
     * Serve one sub-query from the cache, fetching the missing windows one
     * after the other and storing the merged series back.
     */
    private Mono<List<Series>> runCachedQuery(String queryName, String cacheKey, boolean noCache,
                                              long start, long end, long step,
                                              Function<MissInterval, Mono<List<Series>>> fetchWindow) {
        boolean cacheEnabled = !noCache && cache != null && cacheKey != null;

        return Mono.fromCallable(() -> lookupCache(queryName, cacheKey, cacheEnabled))
            .flatMap(cachedData -> {
                Reconciliation reconciliation = reconciler.reconcile(start, end, step, cachedData);
                log.debug("Query {} misses {} (replace={})",
                    queryName, reconciliation.getMisses(), reconciliation.isReplaceCachedData());

                return Flux.fromIterable(reconciliation.getMisses())
                    .concatMap(fetchWindow)
                    .collectList()
                    .map(fetched -> {
                        metrics.recordMissWindowsFetched(reconciliation.getMisses().size());
                        List<Series> missedSeries = new ArrayList<>();
                        fetched.forEach(missedSeries::addAll);

                        List<Series> mergedSeries = reconciliation.isReplaceCachedData()
                            ? missedSeries
                            : merger.merge(decodeCached(queryName, cachedData), missedSeries);

                        if (cacheEnabled && !missedSeries.isEmpty()) {
                            storeInCache(queryName, cacheKey, mergedSeries);
                        }
                        return mergedSeries;
                    });
            });
    }

    private byte[] lookupCache(String queryName, String cacheKey, boolean cacheEnabled) {
        if (!cacheEnabled) {
            return NO_CACHED_DATA;
        }
        try {
            CacheRetrieval retrieval = cache.retrieve(cacheKey, true);
            log.info("Cache retrieve status for query {}: {}", queryName, retrieval.getStatus());
            if (retrieval.hasData()) {
                metrics.recordCacheHit();
                return retrieval.getData();
            }
        } catch (RuntimeException e) {
            log.warn("Cache retrieve failed for query {}, treating as no cached data: {}",
                queryName, e.getMessage());
        }
        metrics.recordCacheMiss();
        return NO_CACHED_DATA;
    }

    private List<Series> decodeCached(String queryName, byte[] cachedData) {
        if (cachedData.length == 0) {
            return new ArrayList<>();
        }
        try {
            return codec.decode(cachedData);
        } catch (CacheAccessException e) {
            log.error("Error decoding cached series for query {}", queryName, e);
            return new ArrayList<>();
        }
    }

    private void storeInCache(String queryName, String cacheKey, List<Series> mergedSeries) {
        try {
            cache.store(cacheKey, codec.encode(mergedSeries), options.getCacheTtl());
            metrics.recordCacheStore();
        } catch (RuntimeException e) {
            log.error("Error storing merged series for query {} in cache", queryName, e);
            metrics.recordCacheStoreFailure();
        }
    }

    /**
     * Trim cached series to the requested window. Points with timestamp 0 are
     * kept.
     */
    private List<Series> filterCachedPoints(List<Series> seriesList, long start, long end) {
        List<Series> trimmed = new ArrayList<>(seriesList.size());
        for (Series series : seriesList) {
            List<Point> points = new ArrayList<>(series.getPoints().size());
            for (Point point : series.getPoints()) {
                long timestamp = point.getTimestamp();
                if ((timestamp >= start && timestamp <= end) || timestamp == 0) {
                    points.add(point);
                }
            }
            Series copy = series.copy();
            copy.setPoints(points);
            trimmed.add(copy);
        }
        return trimmed;
    }

    // ========== Fan-out ==========

    /**
     * Run the units concurrently, at most maxConcurrentQueries of them in
     * flight at a time. Each unit completes with an outcome; errors and
     * timeouts become failed outcomes and never cancel sibling units. A unit's
     * timeout starts when it is subscribed, not while it waits for a slot.
     */
    private Mono<List<QueryOutcome>> fanOut(List<QueryUnit> units) {
        if (units.isEmpty()) {
            return Mono.just(Collections.emptyList());
        }
        int concurrency = Math.min(units.size(), options.getMaxConcurrentQueries());

        return Flux.fromIterable(units)
            .flatMap(unit -> Mono.defer(unit.work)
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(options.getQueryTimeout())
                    .onErrorResume(error -> Mono.just(failed(unit, error))),
                concurrency)
            .collectList();
    }

    private QueryOutcome failed(QueryUnit unit, Throwable error) {
        Throwable cause = Exceptions.unwrap(error);
        if (cause instanceof TimeoutException) {
            log.warn("Query {} timed out after {}", unit.queryName, options.getQueryTimeout());
            metrics.recordSubQueryTimedOut();
            cause = new QueryExecutionException("query timed out after " + options.getQueryTimeout(),
                unit.queryName, unit.query, cause);
        } else {
            log.error("Query {} failed: {}", unit.queryName, cause.getMessage());
        }
        metrics.recordSubQueryFailed();
        return QueryOutcome.failed(unit.queryName, unit.query, cause);
    }

    /**
     * Split outcomes into results and per-query errors. Any failure sets the
     * overall error.
     */
    private QueryRangeResponse collect(List<QueryOutcome> outcomes, String queryKind) {
        List<QueryResult> results = new ArrayList<>();
        Map<String, Throwable> errorsByName = new LinkedHashMap<>();

        for (QueryOutcome outcome : outcomes) {
            switch (outcome.getKind()) {
                case SERIES, ROWS -> results.add(outcome.toResult());
                case FAILED -> errorsByName.put(outcome.getQueryName(), outcome.getError());
            }
        }

        Throwable error = errorsByName.isEmpty()
            ? null
            : new QueryExecutionException("error in " + queryKind + " queries");
        return new QueryRangeResponse(results, errorsByName, error);
    }

    // ========== Panel Validation ==========

    private QueryRangeResponse validatePanel(CompositeQuery compositeQuery, QueryRangeResponse response) {
        if (compositeQuery.getPanelType() != PanelType.VALUE) {
            return response;
        }

        if (compositeQuery.enabledQueries() > 1) {
            metrics.recordValidationFailure();
            return response.withError(new ValidationException(
                "there can be only one active query for value type panel", PanelType.VALUE));
        }

        List<QueryResult> results = response.getResults();
        if (results.size() == 1 && results.get(0).getSeries() != null && results.get(0).getSeries().size() > 1) {
            metrics.recordValidationFailure();
            return response.withError(new ValidationException(
                "there can be only one result series for value type panel but got "
                    + results.get(0).getSeries().size(), PanelType.VALUE));
        }
        return response;
    }

    /**
     * A sub-query waiting to run
     */
    private static final class QueryUnit {
        private final String queryName;
        private final String query;
        private final Supplier<Mono<QueryOutcome>> work;

        private QueryUnit(String queryName, String query, Supplier<Mono<QueryOutcome>> work) {
            this.queryName = queryName;
            this.query = query;
            this.work = work;
        }
    }
}
