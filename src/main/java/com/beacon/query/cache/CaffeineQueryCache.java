package com.beacon.query.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process query cache backed by Caffeine.
 * 
 * Every entry expires after the TTL it was stored with. Expired entries are
 * gone for good, so {@code allowStale} has no effect here.
 */
public class CaffeineQueryCache implements QueryCache {
    
    private static final Logger log = LoggerFactory.getLogger(CaffeineQueryCache.class);
    
    private final Cache<String, Entry> cache;
    
    public CaffeineQueryCache(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }
    
    CaffeineQueryCache(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfter(new EntryExpiry())
            .ticker(ticker)
            .recordStats()
            .build();
        
        log.info("Caffeine query cache initialized (maxSize={})", maximumSize);
    }
    
    @Override
    public CacheRetrieval retrieve(String key, boolean allowStale) {
        Entry entry = cache.getIfPresent(key);
        if (entry == null) {
            return CacheRetrieval.keyMiss();
        }
        return CacheRetrieval.hit(entry.data);
    }
    
    @Override
    public void store(String key, byte[] data, Duration ttl) {
        cache.put(key, new Entry(data, ttl.toNanos()));
        log.debug("Stored {} bytes in cache with key: {}", data.length, key);
    }
    
    @Override
    public void remove(String key) {
        cache.invalidate(key);
        log.debug("Invalidated cache entry: {}", key);
    }
    
    /**
     * Cache statistics for monitoring
     */
    public Map<String, Object> getCacheStats() {
        CacheStats stats = cache.stats();
        
        Map<String, Object> statsMap = new ConcurrentHashMap<>();
        statsMap.put("hitCount", stats.hitCount());
        statsMap.put("missCount", stats.missCount());
        statsMap.put("hitRate", stats.hitRate());
        statsMap.put("evictionCount", stats.evictionCount());
        statsMap.put("estimatedSize", cache.estimatedSize());
        return statsMap;
    }
    
    private static final class Entry {
        private final byte[] data;
        private final long ttlNanos;
        
        private Entry(byte[] data, long ttlNanos) {
            this.data = data;
            this.ttlNanos = ttlNanos;
        }
    }
    
    private static final class EntryExpiry implements Expiry<String, Entry> {
        
        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos;
        }
        
        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos;
        }
        
        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
