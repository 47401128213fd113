package com.beacon.query;

import com.beacon.domain.QueryResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a query range call.
 * 
 * Results of the succeeding sub-queries are returned next to the errors of
 * the failing ones. {@link #getError()} is set whenever the call as a whole
 * failed: a sub-query failed, translation failed, or panel validation
 * rejected the results.
 */
public final class QueryRangeResponse {
    
    private final List<QueryResult> results;
    private final Map<String, Throwable> errorsByName;
    private final Throwable error;
    
    public QueryRangeResponse(List<QueryResult> results, Map<String, Throwable> errorsByName, Throwable error) {
        this.results = results != null ? Collections.unmodifiableList(results) : Collections.emptyList();
        this.errorsByName = errorsByName != null ? Collections.unmodifiableMap(errorsByName) : Collections.emptyMap();
        this.error = error;
    }
    
    public static QueryRangeResponse failed(Throwable error) {
        return new QueryRangeResponse(new ArrayList<>(), new HashMap<>(), error);
    }
    
    /**
     * Copy keeping only the per-query errors the policy exposes. The overall
     * error is kept as is.
     */
    public QueryRangeResponse filterErrors(ErrorExposurePolicy policy) {
        Map<String, Throwable> exposed = new HashMap<>();
        errorsByName.forEach((name, queryError) -> {
            if (policy.isExposed(queryError)) {
                exposed.put(name, queryError);
            }
        });
        return new QueryRangeResponse(results, exposed, error);
    }
    
    public QueryRangeResponse withError(Throwable error) {
        return new QueryRangeResponse(results, errorsByName, error);
    }
    
    public List<QueryResult> getResults() {
        return results;
    }
    
    public Map<String, Throwable> getErrorsByName() {
        return errorsByName;
    }
    
    public Throwable getError() {
        return error;
    }
    
    public boolean hasError() {
        return error != null;
    }
}
