package com.beacon.query.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisQueryCache Tests")
class RedisQueryCacheTest {
    
    @Mock
    private RedisTemplate<String, String> redisTemplate;
    
    @Mock
    private ValueOperations<String, String> valueOperations;
    
    private RedisQueryCache cache;
    
    @BeforeEach
    void setUp() {
        cache = new RedisQueryCache(redisTemplate);
    }
    
    @Test
    @DisplayName("Should read payload under the prefixed key")
    void shouldRetrievePayload() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("querycache:up")).thenReturn("[{\"labels\":{}}]");
        
        // When
        CacheRetrieval retrieval = cache.retrieve("up", true);
        
        // Then
        assertThat(retrieval.getStatus()).isEqualTo(RetrieveStatus.HIT);
        assertThat(new String(retrieval.getData(), StandardCharsets.UTF_8)).isEqualTo("[{\"labels\":{}}]");
    }
    
    @Test
    @DisplayName("Should report a key miss when Redis has no value")
    void shouldReportKeyMiss() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("querycache:up")).thenReturn(null);
        
        // When/Then
        assertThat(cache.retrieve("up", true).getStatus()).isEqualTo(RetrieveStatus.KEY_MISS);
    }
    
    @Test
    @DisplayName("Should write payload with TTL")
    void shouldStoreWithTtl() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        
        // When
        cache.store("up", "[]".getBytes(StandardCharsets.UTF_8), Duration.ofHours(1));
        
        // Then
        verify(valueOperations).set("querycache:up", "[]", Duration.ofHours(1));
    }
    
    @Test
    @DisplayName("Should wrap Redis failures")
    void shouldWrapFailures() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("connection refused"));
        
        // When/Then
        assertThatThrownBy(() -> cache.retrieve("up", true))
            .isInstanceOf(CacheAccessException.class)
            .hasCauseInstanceOf(RedisConnectionFailureException.class);
    }
    
    @Test
    @DisplayName("Should delete the prefixed key on remove")
    void shouldRemove() {
        cache.remove("up");
        
        verify(redisTemplate).delete("querycache:up");
    }
    
    @Test
    @DisplayName("Should wrap failures on store")
    void shouldWrapStoreFailures() {
        // Given
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        doThrow(new RedisConnectionFailureException("connection refused"))
            .when(valueOperations).set(anyString(), anyString(), any(Duration.class));
        
        // When/Then
        assertThatThrownBy(() -> cache.store("up", new byte[0], Duration.ofMinutes(1)))
            .isInstanceOf(CacheAccessException.class);
    }
}
