package com.beacon.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Presentation mode of a query result. Constrains the shape of the result
 * (a value panel holds a single series) and, for builder queries, selects
 * between the series and the row oriented execution paths.
 */
public enum PanelType {
    
    GRAPH("graph"),
    
    VALUE("value"),
    
    TABLE("table"),
    
    LIST("list"),
    
    TRACE("trace");
    
    private final String value;
    
    PanelType(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    /**
     * List and trace panels render rows rather than time series
     */
    public boolean isRowOriented() {
        return this == LIST || this == TRACE;
    }
    
    @JsonCreator
    public static PanelType fromValue(String value) {
        for (PanelType type : PanelType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown PanelType value: " + value);
    }
}
