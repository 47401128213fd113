package com.beacon.query.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CaffeineQueryCache Tests")
class CaffeineQueryCacheTest {
    
    private final AtomicLong nanos = new AtomicLong();
    private CaffeineQueryCache cache;
    
    @BeforeEach
    void setUp() {
        cache = new CaffeineQueryCache(100, nanos::get);
    }
    
    @Test
    @DisplayName("Should return stored payload as a hit")
    void shouldReturnStoredPayload() {
        cache.store("key", bytes("[]"), Duration.ofMinutes(1));
        
        CacheRetrieval retrieval = cache.retrieve("key", true);
        
        assertThat(retrieval.getStatus()).isEqualTo(RetrieveStatus.HIT);
        assertThat(retrieval.getData()).isEqualTo(bytes("[]"));
    }
    
    @Test
    @DisplayName("Should report a key miss for unknown keys")
    void shouldReportKeyMiss() {
        CacheRetrieval retrieval = cache.retrieve("unknown", true);
        
        assertThat(retrieval.getStatus()).isEqualTo(RetrieveStatus.KEY_MISS);
        assertThat(retrieval.hasData()).isFalse();
    }
    
    @Test
    @DisplayName("Should expire entries after their own TTL")
    void shouldExpireAfterTtl() {
        cache.store("short", bytes("[1]"), Duration.ofSeconds(10));
        cache.store("long", bytes("[2]"), Duration.ofHours(1));
        
        nanos.addAndGet(Duration.ofSeconds(11).toNanos());
        
        assertThat(cache.retrieve("short", true).hasData()).isFalse();
        assertThat(cache.retrieve("long", true).getData()).isEqualTo(bytes("[2]"));
    }
    
    @Test
    @DisplayName("Should replace payload and TTL on store")
    void shouldReplaceOnStore() {
        cache.store("key", bytes("[1]"), Duration.ofSeconds(10));
        cache.store("key", bytes("[2]"), Duration.ofHours(1));
        
        nanos.addAndGet(Duration.ofSeconds(11).toNanos());
        
        assertThat(cache.retrieve("key", true).getData()).isEqualTo(bytes("[2]"));
    }
    
    @Test
    @DisplayName("Should drop removed entries")
    void shouldRemoveEntry() {
        cache.store("key", bytes("[]"), Duration.ofMinutes(1));
        
        cache.remove("key");
        
        assertThat(cache.retrieve("key", true).getStatus()).isEqualTo(RetrieveStatus.KEY_MISS);
        assertThat(cache.getCacheStats()).containsKeys("hitCount", "missCount", "estimatedSize");
    }
    
    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
