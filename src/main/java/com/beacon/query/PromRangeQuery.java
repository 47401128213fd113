package com.beacon.query;

import com.beacon.domain.PromQuery;

import java.time.Duration;
import java.time.Instant;

/**
 * PromQL range query restricted to one window
 */
public final class PromRangeQuery {
    
    private final String query;
    private final Instant start;
    private final Instant end;
    private final Duration step;
    
    public PromRangeQuery(String query, Instant start, Instant end, Duration step) {
        this.query = query;
        this.start = start;
        this.end = end;
        this.step = step;
    }
    
    /**
     * @param step step in seconds
     * @param start window start in epoch ms
     * @param end window end in epoch ms
     */
    public static PromRangeQuery of(PromQuery promQuery, long step, long start, long end) {
        return new PromRangeQuery(
            promQuery.getQuery(),
            Instant.ofEpochMilli(start),
            Instant.ofEpochMilli(end),
            Duration.ofSeconds(step));
    }
    
    public String getQuery() {
        return query;
    }
    
    public Instant getStart() {
        return start;
    }
    
    public Instant getEnd() {
        return end;
    }
    
    public Duration getStep() {
        return step;
    }
    
    @Override
    public String toString() {
        return query + " [" + start + ", " + end + "] step " + step;
    }
}
