package com.beacon.query.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.RedisTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Query cache shared between instances through Redis.
 * 
 * Payloads are JSON, so they are stored as UTF-8 strings under a common key
 * prefix. Redis drops expired keys itself; {@code allowStale} has no effect.
 */
public class RedisQueryCache implements QueryCache {
    
    private static final Logger log = LoggerFactory.getLogger(RedisQueryCache.class);
    
    /**
     * Redis key prefix for query cache entries
     */
    static final String KEY_PREFIX = "querycache:";
    
    private final RedisTemplate<String, String> redisTemplate;
    
    public RedisQueryCache(RedisTemplate<String, String> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }
    
    @Override
    public CacheRetrieval retrieve(String key, boolean allowStale) {
        try {
            String value = redisTemplate.opsForValue().get(KEY_PREFIX + key);
            if (value == null) {
                return CacheRetrieval.keyMiss();
            }
            return CacheRetrieval.hit(value.getBytes(StandardCharsets.UTF_8));
        } catch (Exception e) {
            log.error("Failed to retrieve cache entry: {}", key, e);
            throw new CacheAccessException("Failed to retrieve cache entry", e);
        }
    }
    
    @Override
    public void store(String key, byte[] data, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + key, new String(data, StandardCharsets.UTF_8), ttl);
            log.debug("Stored {} bytes in Redis with key: {}", data.length, key);
        } catch (Exception e) {
            log.error("Failed to store cache entry: {}", key, e);
            throw new CacheAccessException("Failed to store cache entry", e);
        }
    }
    
    @Override
    public void remove(String key) {
        try {
            redisTemplate.delete(KEY_PREFIX + key);
        } catch (Exception e) {
            log.error("Failed to remove cache entry: {}", key, e);
            throw new CacheAccessException("Failed to remove cache entry", e);
        }
    }
}
