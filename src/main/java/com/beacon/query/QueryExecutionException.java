package com.beacon.query;

/**
 * Exception thrown when executing a sub-query fails.
 * Carries the name of the failed sub-query and, where known, the query text.
 */
public class QueryExecutionException extends RuntimeException {
    
    private final String queryName;
    private final String query;
    
    public QueryExecutionException(String message) {
        super(message);
        this.queryName = null;
        this.query = null;
    }
    
    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.queryName = null;
        this.query = null;
    }
    
    public QueryExecutionException(String message, String queryName, String query, Throwable cause) {
        super(message, cause);
        this.queryName = queryName;
        this.query = query;
    }
    
    public String getQueryName() {
        return queryName;
    }
    
    public String getQuery() {
        return query;
    }
    
    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (queryName != null) {
            sb.append(" [Query name: ").append(queryName).append("]");
        }
        if (query != null) {
            sb.append(" [Query: ").append(query).append("]");
        }
        return sb.toString();
    }
}
