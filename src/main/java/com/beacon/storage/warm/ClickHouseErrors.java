package com.beacon.storage.warm;

import com.beacon.query.QueryExecutionException;
import com.beacon.query.ResourceLimitException;

import java.sql.SQLException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies ClickHouse failures. Server side limits on scanned bytes and
 * execution time become {@link ResourceLimitException}s, everything else a
 * plain {@link QueryExecutionException}.
 */
final class ClickHouseErrors {
    
    static final int TIMEOUT_EXCEEDED = 159;
    static final int TOO_MANY_BYTES = 307;
    
    private static final Pattern CODE_PATTERN = Pattern.compile("Code: (\\d+)");
    
    private ClickHouseErrors() {
    }
    
    static RuntimeException translate(Throwable error, String query) {
        int code = errorCode(error);
        if (code == TOO_MANY_BYTES) {
            return new ResourceLimitException(ResourceLimitException.BYTES_LIMIT_MESSAGE, error);
        }
        if (code == TIMEOUT_EXCEEDED) {
            return new ResourceLimitException(ResourceLimitException.TIME_LIMIT_MESSAGE, error);
        }
        if (error instanceof QueryExecutionException) {
            return (QueryExecutionException) error;
        }
        return new QueryExecutionException("ClickHouse query execution failed: " + error.getMessage(),
            null, query, error);
    }
    
    /**
     * ClickHouse error code found in the cause chain, or -1
     */
    static int errorCode(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof SQLException && ((SQLException) current).getErrorCode() > 0) {
                return ((SQLException) current).getErrorCode();
            }
            if (current.getMessage() != null) {
                Matcher matcher = CODE_PATTERN.matcher(current.getMessage());
                if (matcher.find()) {
                    return Integer.parseInt(matcher.group(1));
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return -1;
    }
}
