package com.beacon.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The set of named sub-queries of a request together with the backend they
 * target and the panel they are rendered in. Only the map matching
 * {@link #getQueryType()} is consulted.
 */
public class CompositeQuery {
    
    @JsonProperty("queryType")
    private QueryType queryType;
    
    @JsonProperty("panelType")
    private PanelType panelType;
    
    @JsonProperty("builderQueries")
    private Map<String, BuilderQuery> builderQueries = new LinkedHashMap<>();
    
    @JsonProperty("promQueries")
    private Map<String, PromQuery> promQueries = new LinkedHashMap<>();
    
    @JsonProperty("chQueries")
    private Map<String, ClickHouseQuery> clickHouseQueries = new LinkedHashMap<>();
    
    public CompositeQuery() {
    }
    
    public CompositeQuery(QueryType queryType, PanelType panelType) {
        this.queryType = queryType;
        this.panelType = panelType;
    }
    
    /**
     * Number of sub-queries of the declared query type that are not disabled
     */
    public int enabledQueries() {
        if (queryType == null) {
            return 0;
        }
        return switch (queryType) {
            case BUILDER -> (int) builderQueries.values().stream()
                .filter(query -> !query.isDisabled())
                .count();
            case CLICKHOUSE_SQL -> (int) clickHouseQueries.values().stream()
                .filter(query -> !query.isDisabled())
                .count();
            case PROMQL -> (int) promQueries.values().stream()
                .filter(query -> !query.isDisabled())
                .count();
        };
    }
    
    public QueryType getQueryType() {
        return queryType;
    }
    
    public void setQueryType(QueryType queryType) {
        this.queryType = queryType;
    }
    
    public PanelType getPanelType() {
        return panelType;
    }
    
    public void setPanelType(PanelType panelType) {
        this.panelType = panelType;
    }
    
    public Map<String, BuilderQuery> getBuilderQueries() {
        return builderQueries;
    }
    
    public void setBuilderQueries(Map<String, BuilderQuery> builderQueries) {
        this.builderQueries = builderQueries != null ? builderQueries : new LinkedHashMap<>();
    }
    
    public Map<String, PromQuery> getPromQueries() {
        return promQueries;
    }
    
    public void setPromQueries(Map<String, PromQuery> promQueries) {
        this.promQueries = promQueries != null ? promQueries : new LinkedHashMap<>();
    }
    
    public Map<String, ClickHouseQuery> getClickHouseQueries() {
        return clickHouseQueries;
    }
    
    public void setClickHouseQueries(Map<String, ClickHouseQuery> clickHouseQueries) {
        this.clickHouseQueries = clickHouseQueries != null ? clickHouseQueries : new LinkedHashMap<>();
    }
}
