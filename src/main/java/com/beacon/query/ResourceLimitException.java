package com.beacon.query;

/**
 * A query exceeded a resource limit of the backend (bytes scanned, execution
 * time). Unlike internal failures this is actionable by the user, typically by
 * adding filters, and is always reported per query.
 */
public class ResourceLimitException extends QueryExecutionException {
    
    public static final String BYTES_LIMIT_MESSAGE =
        "resource limits exceeded, try applying filters such as service.name, etc. to reduce the data size";
    
    public static final String TIME_LIMIT_MESSAGE =
        "resource time limit exceeded, try applying filters such as service.name, etc. to reduce the data size";
    
    public ResourceLimitException(String message) {
        super(message);
    }
    
    public ResourceLimitException(String message, Throwable cause) {
        super(message, cause);
    }
    
    /**
     * Whether the throwable or any of its causes is a resource limit failure
     */
    public static boolean isResourceLimit(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ResourceLimitException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
