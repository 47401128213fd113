package com.beacon.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Conjunction or disjunction of filter items
 */
public class FilterSet {
    
    @JsonProperty("op")
    private String operator = "AND";
    
    @JsonProperty("items")
    private List<FilterItem> items = new ArrayList<>();
    
    public FilterSet() {
    }
    
    public FilterSet(String operator, List<FilterItem> items) {
        this.operator = operator;
        this.items = items != null ? items : new ArrayList<>();
    }
    
    public String getOperator() {
        return operator;
    }
    
    public void setOperator(String operator) {
        this.operator = operator;
    }
    
    public List<FilterItem> getItems() {
        return items;
    }
    
    public void setItems(List<FilterItem> items) {
        this.items = items;
    }
}
