package com.beacon.query;

/**
 * Decides which per-query errors are reported back to the caller by name.
 * Errors that are not exposed still make the overall call fail.
 */
@FunctionalInterface
public interface ErrorExposurePolicy {
    
    boolean isExposed(Throwable error);
    
    /**
     * Only resource limit errors; everything else is internal and not
     * actionable by the user
     */
    static ErrorExposurePolicy resourceLimitsOnly() {
        return ResourceLimitException::isResourceLimit;
    }
    
    static ErrorExposurePolicy exposeAll() {
        return error -> true;
    }
}
