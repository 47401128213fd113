package com.beacon.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured query against metrics, logs or traces. The querier treats it as
 * an opaque unit of work; translation to SQL happens in a
 * {@link com.beacon.query.QueryTranslator}.
 * 
 * A query whose name equals its expression is a final query and is executed
 * on its own. Other queries are formulas over final queries.
 */
public class BuilderQuery {
    
    @JsonProperty("queryName")
    private String queryName;
    
    /**
     * Step of the resulting series in seconds
     */
    @JsonProperty("stepInterval")
    private long stepInterval;
    
    @JsonProperty("dataSource")
    private DataSource dataSource;
    
    @JsonProperty("aggregateOperator")
    private String aggregateOperator;
    
    @JsonProperty("aggregateAttribute")
    private AttributeKey aggregateAttribute;
    
    @JsonProperty("filters")
    private FilterSet filters;
    
    @JsonProperty("groupBy")
    private List<AttributeKey> groupBy = new ArrayList<>();
    
    @JsonProperty("expression")
    private String expression;
    
    @JsonProperty("disabled")
    private boolean disabled;
    
    /**
     * Shift of the query window into the past, in seconds
     */
    @JsonProperty("shiftBy")
    private long shiftBy;
    
    @JsonProperty("limit")
    private long limit;
    
    @JsonProperty("offset")
    private long offset;
    
    @JsonProperty("pageSize")
    private long pageSize;
    
    public BuilderQuery() {
    }
    
    /**
     * Final query whose expression is its own name
     */
    public BuilderQuery(String queryName, DataSource dataSource, long stepInterval) {
        this.queryName = queryName;
        this.expression = queryName;
        this.dataSource = dataSource;
        this.stepInterval = stepInterval;
    }
    
    @JsonIgnore
    public boolean isFinal() {
        return queryName != null && queryName.equals(expression);
    }
    
    public String getQueryName() {
        return queryName;
    }
    
    public void setQueryName(String queryName) {
        this.queryName = queryName;
    }
    
    public long getStepInterval() {
        return stepInterval;
    }
    
    public void setStepInterval(long stepInterval) {
        this.stepInterval = stepInterval;
    }
    
    public DataSource getDataSource() {
        return dataSource;
    }
    
    public void setDataSource(DataSource dataSource) {
        this.dataSource = dataSource;
    }
    
    public String getAggregateOperator() {
        return aggregateOperator;
    }
    
    public void setAggregateOperator(String aggregateOperator) {
        this.aggregateOperator = aggregateOperator;
    }
    
    public AttributeKey getAggregateAttribute() {
        return aggregateAttribute;
    }
    
    public void setAggregateAttribute(AttributeKey aggregateAttribute) {
        this.aggregateAttribute = aggregateAttribute;
    }
    
    public FilterSet getFilters() {
        return filters;
    }
    
    public void setFilters(FilterSet filters) {
        this.filters = filters;
    }
    
    public List<AttributeKey> getGroupBy() {
        return groupBy;
    }
    
    public void setGroupBy(List<AttributeKey> groupBy) {
        this.groupBy = groupBy != null ? groupBy : new ArrayList<>();
    }
    
    public String getExpression() {
        return expression;
    }
    
    public void setExpression(String expression) {
        this.expression = expression;
    }
    
    public boolean isDisabled() {
        return disabled;
    }
    
    public void setDisabled(boolean disabled) {
        this.disabled = disabled;
    }
    
    public long getShiftBy() {
        return shiftBy;
    }
    
    public void setShiftBy(long shiftBy) {
        this.shiftBy = shiftBy;
    }
    
    public long getLimit() {
        return limit;
    }
    
    public void setLimit(long limit) {
        this.limit = limit;
    }
    
    public long getOffset() {
        return offset;
    }
    
    public void setOffset(long offset) {
        this.offset = offset;
    }
    
    public long getPageSize() {
        return pageSize;
    }
    
    public void setPageSize(long pageSize) {
        this.pageSize = pageSize;
    }
}
