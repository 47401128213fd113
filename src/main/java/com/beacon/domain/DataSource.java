package com.beacon.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Signal a builder query reads from.
 */
public enum DataSource {
    
    METRICS("metrics"),
    
    LOGS("logs"),
    
    TRACES("traces");
    
    private final String value;
    
    DataSource(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    @Override
    public String toString() {
        return value;
    }
    
    @JsonCreator
    public static DataSource fromValue(String value) {
        for (DataSource source : DataSource.values()) {
            if (source.value.equalsIgnoreCase(value)) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown DataSource value: " + value);
    }
}
