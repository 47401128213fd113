package com.beacon.query;

import com.beacon.domain.QueryResult;
import com.beacon.domain.Row;
import com.beacon.domain.Series;

import java.util.List;

/**
 * What a single query unit produced: series, rows, or a failure.
 * Exactly one of the payloads is set, as told by {@link #getKind()}.
 */
public final class QueryOutcome {
    
    public enum Kind {
        SERIES,
        ROWS,
        FAILED
    }
    
    private final Kind kind;
    private final String queryName;
    private final String query;
    private final List<Series> series;
    private final List<Row> rows;
    private final Throwable error;
    
    private QueryOutcome(Kind kind, String queryName, String query,
                         List<Series> series, List<Row> rows, Throwable error) {
        this.kind = kind;
        this.queryName = queryName;
        this.query = query;
        this.series = series;
        this.rows = rows;
        this.error = error;
    }
    
    public static QueryOutcome series(String queryName, String query, List<Series> series) {
        return new QueryOutcome(Kind.SERIES, queryName, query, series, null, null);
    }
    
    public static QueryOutcome rows(String queryName, String query, List<Row> rows) {
        return new QueryOutcome(Kind.ROWS, queryName, query, null, rows, null);
    }
    
    public static QueryOutcome failed(String queryName, String query, Throwable error) {
        return new QueryOutcome(Kind.FAILED, queryName, query, null, null, error);
    }
    
    /**
     * The result for a successful outcome
     * 
     * @throws IllegalStateException for a failed outcome
     */
    public QueryResult toResult() {
        return switch (kind) {
            case SERIES -> QueryResult.ofSeries(queryName, series);
            case ROWS -> QueryResult.ofList(queryName, rows);
            case FAILED -> throw new IllegalStateException("query " + queryName + " failed", error);
        };
    }
    
    public Kind getKind() {
        return kind;
    }
    
    public String getQueryName() {
        return queryName;
    }
    
    public String getQuery() {
        return query;
    }
    
    public List<Series> getSeries() {
        return series;
    }
    
    public List<Row> getRows() {
        return rows;
    }
    
    public Throwable getError() {
        return error;
    }
}
