package com.beacon.query.cache;

/**
 * Outcome of a cache lookup
 */
public enum RetrieveStatus {
    HIT,
    PARTIAL_HIT,
    RANGE_MISS,
    KEY_MISS,
    REVALIDATED,
    ERROR
}
