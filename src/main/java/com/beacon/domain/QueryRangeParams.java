package com.beacon.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashMap;
import java.util.Map;

/**
 * A time range query request. Created per call and owned by it.
 */
public class QueryRangeParams {
    
    /**
     * Window start in epoch milliseconds
     */
    @JsonProperty("start")
    private long start;
    
    /**
     * Window end in epoch milliseconds
     */
    @JsonProperty("end")
    private long end;
    
    /**
     * Step in seconds
     */
    @JsonProperty("step")
    private long step;
    
    @JsonProperty("compositeQuery")
    private CompositeQuery compositeQuery;
    
    @JsonProperty("variables")
    private Map<String, Object> variables = new HashMap<>();
    
    @JsonProperty("noCache")
    private boolean noCache;
    
    public QueryRangeParams() {
    }
    
    public QueryRangeParams(long start, long end, long step, CompositeQuery compositeQuery) {
        this.start = start;
        this.end = end;
        this.step = step;
        this.compositeQuery = compositeQuery;
    }
    
    public long getStart() {
        return start;
    }
    
    public void setStart(long start) {
        this.start = start;
    }
    
    public long getEnd() {
        return end;
    }
    
    public void setEnd(long end) {
        this.end = end;
    }
    
    public long getStep() {
        return step;
    }
    
    public void setStep(long step) {
        this.step = step;
    }
    
    public CompositeQuery getCompositeQuery() {
        return compositeQuery;
    }
    
    public void setCompositeQuery(CompositeQuery compositeQuery) {
        this.compositeQuery = compositeQuery;
    }
    
    public Map<String, Object> getVariables() {
        return variables;
    }
    
    public void setVariables(Map<String, Object> variables) {
        this.variables = variables != null ? variables : new HashMap<>();
    }
    
    public boolean isNoCache() {
        return noCache;
    }
    
    public void setNoCache(boolean noCache) {
        this.noCache = noCache;
    }
}
