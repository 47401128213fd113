package com.beacon.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Single predicate of a builder query filter, e.g. {@code service.name = "api"}.
 */
public class FilterItem {
    
    @JsonProperty("key")
    private AttributeKey key;
    
    @JsonProperty("value")
    private Object value;
    
    @JsonProperty("op")
    private String operator;
    
    public FilterItem() {
    }
    
    public FilterItem(AttributeKey key, Object value, String operator) {
        this.key = key;
        this.value = value;
        this.operator = operator;
    }
    
    public String cacheKey() {
        String keyPart = key != null ? key.cacheKey() : "";
        return "key:" + keyPart + ",op:" + operator + ",value:" + value;
    }
    
    public AttributeKey getKey() {
        return key;
    }
    
    public void setKey(AttributeKey key) {
        this.key = key;
    }
    
    public Object getValue() {
        return value;
    }
    
    public void setValue(Object value) {
        this.value = value;
    }
    
    public String getOperator() {
        return operator;
    }
    
    public void setOperator(String operator) {
        this.operator = operator;
    }
}
