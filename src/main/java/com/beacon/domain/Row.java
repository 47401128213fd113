package com.beacon.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * One record of a list or trace panel. Rows are not time series and are
 * never cached or merged.
 */
public class Row {
    
    @JsonProperty("timestamp")
    private Instant timestamp;
    
    @JsonProperty("data")
    private Map<String, Object> data;
    
    public Row() {
        this.data = new HashMap<>();
    }
    
    public Row(Instant timestamp, Map<String, Object> data) {
        this.timestamp = timestamp;
        this.data = data != null ? data : new HashMap<>();
    }
    
    public Instant getTimestamp() {
        return timestamp;
    }
    
    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }
    
    public Map<String, Object> getData() {
        return data;
    }
    
    public void setData(Map<String, Object> data) {
        this.data = data;
    }
}
