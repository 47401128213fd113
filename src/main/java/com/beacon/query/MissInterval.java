package com.beacon.query;

import java.util.Objects;

/**
 * A sub-window of the requested range that is not covered by cached data.
 * Bounds are inclusive epoch milliseconds.
 */
public final class MissInterval {
    
    private final long start;
    private final long end;
    
    public MissInterval(long start, long end) {
        this.start = start;
        this.end = end;
    }
    
    public long getStart() {
        return start;
    }
    
    public long getEnd() {
        return end;
    }
    
    /**
     * Only intervals with start strictly before end are fetched
     */
    public boolean isValid() {
        return start < end;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MissInterval)) {
            return false;
        }
        MissInterval other = (MissInterval) o;
        return start == other.start && end == other.end;
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }
    
    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
