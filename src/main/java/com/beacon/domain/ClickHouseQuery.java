package com.beacon.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw ClickHouse SQL returning time series rows
 */
public class ClickHouseQuery {
    
    @JsonProperty("query")
    private String query;
    
    @JsonProperty("disabled")
    private boolean disabled;
    
    public ClickHouseQuery() {
    }
    
    public ClickHouseQuery(String query) {
        this.query = query;
    }
    
    public String getQuery() {
        return query;
    }
    
    public void setQuery(String query) {
        this.query = query;
    }
    
    public boolean isDisabled() {
        return disabled;
    }
    
    public void setDisabled(boolean disabled) {
        this.disabled = disabled;
    }
}
