package com.beacon.query;

import com.beacon.domain.Point;
import com.beacon.domain.Series;
import com.beacon.query.cache.CacheAccessException;
import com.beacon.query.cache.SeriesCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Works out which parts of a requested window have to be fetched from the
 * backend, given the series already cached for the sub-query.
 * 
 * The trailing flux interval before "now" is never trusted from the cache:
 * data there may still be ingesting, so it is always reported as missing.
 */
public class TimeRangeReconciler {
    
    private static final Logger log = LoggerFactory.getLogger(TimeRangeReconciler.class);
    
    /**
     * Upper bound for the step used to round "now", in seconds
     */
    private static final long MAX_ROUNDING_STEP_SECONDS = 60;
    
    private final Duration fluxInterval;
    private final Clock clock;
    private final SeriesCodec codec;
    
    public TimeRangeReconciler(Duration fluxInterval, Clock clock, SeriesCodec codec) {
        this.fluxInterval = fluxInterval;
        this.clock = clock;
        this.codec = codec;
    }
    
    /**
     * Reconcile against a cached payload. A payload that is absent or cannot
     * be decoded is treated as no cached data: the whole window is missing and
     * the cache entry is to be replaced.
     */
    public Reconciliation reconcile(long start, long end, long step, byte[] cachedData) {
        List<Series> cachedSeries;
        try {
            cachedSeries = codec.decode(cachedData);
        } catch (CacheAccessException e) {
            log.debug("No usable cached data, fetching [{}, {}] in full: {}", start, end, e.getMessage());
            List<MissInterval> misses = new ArrayList<>();
            misses.add(new MissInterval(start, end));
            return new Reconciliation(misses, true);
        }
        return reconcile(start, end, step, cachedSeries);
    }
    
    /**
     * Reconcile the window [start, end] (ms) against cached series.
     * 
     * @param step step of the query in seconds; "now" is rounded down to
     *             min(step, 60) seconds
     */
    public Reconciliation reconcile(long start, long end, long step, List<Series> cachedSeries) {
        long cachedStart = 0;
        long cachedEnd = 0;
        for (Series series : cachedSeries) {
            for (Point point : series.getPoints()) {
                long timestamp = point.getTimestamp();
                if (cachedStart == 0 || timestamp < cachedStart) {
                    cachedStart = timestamp;
                }
                if (cachedEnd == 0 || timestamp > cachedEnd) {
                    cachedEnd = timestamp;
                }
            }
        }
        
        long nowMillis = clock.millis();
        long roundingMillis = Math.min(step, MAX_ROUNDING_STEP_SECONDS) * 1000;
        long roundedNow = roundingMillis > 0 ? nowMillis - (nowMillis % roundingMillis) : nowMillis;
        
        // the flux interval is always treated as missing
        cachedEnd = Math.min(cachedEnd, roundedNow - fluxInterval.toMillis());
        
        List<MissInterval> misses = new ArrayList<>();
        boolean replaceCachedData = false;

        if (cachedEnd < cachedStart) {
            // everything cached lies inside the flux interval, nothing is trusted
            misses.add(new MissInterval(start, end));
            replaceCachedData = true;
        } else if (cachedStart >= start && cachedEnd <= end) {
            // cached range inside the requested range
            misses.add(new MissInterval(start, cachedStart - 1));
            misses.add(new MissInterval(cachedEnd + 1, end));
        } else if (cachedStart <= start && cachedEnd >= end) {
            // cached range covers the requested range
        } else if (cachedStart <= start && cachedEnd >= start) {
            // left overlap
            misses.add(new MissInterval(cachedEnd + 1, end));
        } else if (cachedStart <= end && cachedEnd >= end) {
            // right overlap
            misses.add(new MissInterval(start, cachedStart - 1));
        } else {
            // disjoint
            misses.add(new MissInterval(start, end));
            replaceCachedData = true;
        }
        
        List<MissInterval> validMisses = new ArrayList<>(misses.size());
        for (MissInterval miss : misses) {
            if (miss.isValid()) {
                validMisses.add(miss);
            }
        }
        
        log.trace("Cached [{}, {}] against requested [{}, {}]: misses={}, replace={}",
            cachedStart, cachedEnd, start, end, validMisses, replaceCachedData);
        return new Reconciliation(validMisses, replaceCachedData);
    }
}
