package com.beacon.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Backend a composite query is expressed against.
 * The querier picks its execution strategy solely from this value.
 */
public enum QueryType {
    
    /**
     * Structured metric/log/trace query, translated to ClickHouse SQL
     */
    BUILDER("builder_query"),
    
    /**
     * Raw ClickHouse SQL written by the user
     */
    CLICKHOUSE_SQL("clickhouse_sql"),
    
    /**
     * PromQL range query
     */
    PROMQL("promql");
    
    private final String value;
    
    QueryType(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    /**
     * Parse a string value to QueryType
     */
    @JsonCreator
    public static QueryType fromValue(String value) {
        for (QueryType type : QueryType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown QueryType value: " + value);
    }
}
