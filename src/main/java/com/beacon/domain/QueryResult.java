package com.beacon.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Result of one named sub-query. Series oriented paths fill
 * {@link #getSeries()}, the list path fills {@link #getList()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResult {
    
    @JsonProperty("queryName")
    private String queryName;
    
    @JsonProperty("series")
    private List<Series> series;
    
    @JsonProperty("list")
    private List<Row> list;
    
    public QueryResult() {
    }
    
    public static QueryResult ofSeries(String queryName, List<Series> series) {
        QueryResult result = new QueryResult();
        result.setQueryName(queryName);
        result.setSeries(series);
        return result;
    }
    
    public static QueryResult ofList(String queryName, List<Row> rows) {
        QueryResult result = new QueryResult();
        result.setQueryName(queryName);
        result.setList(rows);
        return result;
    }
    
    public String getQueryName() {
        return queryName;
    }
    
    public void setQueryName(String queryName) {
        this.queryName = queryName;
    }
    
    public List<Series> getSeries() {
        return series;
    }
    
    public void setSeries(List<Series> series) {
        this.series = series;
    }
    
    public List<Row> getList() {
        return list;
    }
    
    public void setList(List<Row> list) {
        this.list = list;
    }
}
