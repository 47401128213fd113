package com.beacon.query.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

/**
 * Selects the query cache implementation.
 * 
 * beacon.cache.provider:
 * - caffeine (default): in-process cache
 * - redis: shared cache through the application's Redis connection
 * - none: no cache, every query is fetched in full
 */
@Configuration
public class CacheConfig {
    
    private static final Logger logger = LoggerFactory.getLogger(CacheConfig.class);
    
    @Value("${beacon.cache.caffeine.max-size:10000}")
    private long caffeineMaxSize;
    
    @Bean
    @ConditionalOnProperty(name = "beacon.cache.provider", havingValue = "caffeine", matchIfMissing = true)
    public QueryCache caffeineQueryCache() {
        return new CaffeineQueryCache(caffeineMaxSize);
    }
    
    @Bean
    @ConditionalOnProperty(name = "beacon.cache.provider", havingValue = "redis")
    public QueryCache redisQueryCache(RedisTemplate<String, String> redisTemplate) {
        logger.info("Using Redis query cache");
        return new RedisQueryCache(redisTemplate);
    }
}
