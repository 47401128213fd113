package com.beacon.query;

/**
 * A builder query could not be translated into backend query text.
 */
public class TranslationException extends QueryExecutionException {
    
    public TranslationException(String message, String queryName) {
        super(message, queryName, null, null);
    }
    
    public TranslationException(String message, String queryName, Throwable cause) {
        super(message, queryName, null, cause);
    }
}
