package com.beacon.query;

import java.util.Collections;
import java.util.List;

/**
 * Windows to fetch for a sub-query, and whether the fetched data replaces
 * the cached data instead of being merged into it.
 */
public final class Reconciliation {
    
    private final List<MissInterval> misses;
    private final boolean replaceCachedData;
    
    public Reconciliation(List<MissInterval> misses, boolean replaceCachedData) {
        this.misses = Collections.unmodifiableList(misses);
        this.replaceCachedData = replaceCachedData;
    }
    
    public List<MissInterval> getMisses() {
        return misses;
    }
    
    public boolean isReplaceCachedData() {
        return replaceCachedData;
    }
    
    @Override
    public String toString() {
        return "Reconciliation{misses=" + misses + ", replaceCachedData=" + replaceCachedData + "}";
    }
}
