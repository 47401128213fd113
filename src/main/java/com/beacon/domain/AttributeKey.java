package com.beacon.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Attribute (column, tag or resource attribute) referenced by a builder query.
 */
public class AttributeKey {
    
    @JsonProperty("key")
    private String key;
    
    @JsonProperty("dataType")
    private String dataType;
    
    @JsonProperty("type")
    private String type;
    
    @JsonProperty("isColumn")
    private boolean column;
    
    public AttributeKey() {
    }
    
    public AttributeKey(String key, String dataType, String type, boolean column) {
        this.key = key;
        this.dataType = dataType;
        this.type = type;
        this.column = column;
    }
    
    /**
     * Stable textual form used when deriving cache keys
     */
    public String cacheKey() {
        return "key:" + key + ",dataType:" + dataType + ",type:" + type + ",isColumn:" + column;
    }
    
    public String getKey() {
        return key;
    }
    
    public void setKey(String key) {
        this.key = key;
    }
    
    public String getDataType() {
        return dataType;
    }
    
    public void setDataType(String dataType) {
        this.dataType = dataType;
    }
    
    public String getType() {
        return type;
    }
    
    public void setType(String type) {
        this.type = type;
    }
    
    public boolean isColumn() {
        return column;
    }
    
    public void setColumn(boolean column) {
        this.column = column;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AttributeKey)) {
            return false;
        }
        AttributeKey other = (AttributeKey) o;
        return column == other.column
            && Objects.equals(key, other.key)
            && Objects.equals(dataType, other.dataType)
            && Objects.equals(type, other.type);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(key, dataType, type, column);
    }
}
