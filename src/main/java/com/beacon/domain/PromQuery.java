package com.beacon.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * PromQL expression evaluated over the request window
 */
public class PromQuery {
    
    @JsonProperty("query")
    private String query;
    
    @JsonProperty("disabled")
    private boolean disabled;
    
    public PromQuery() {
    }
    
    public PromQuery(String query) {
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
