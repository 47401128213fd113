package com.beacon.query.cache;

import com.beacon.domain.Point;
import com.beacon.domain.Series;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SeriesCodec Tests")
class SeriesCodecTest {
    
    private final SeriesCodec codec = new SeriesCodec(new ObjectMapper());
    
    @Test
    @DisplayName("Should encode series as a JSON array with string values")
    void shouldEncodeAsJsonArray() {
        Series series = new Series(Map.of("job", "api"), List.of(new Point(1000, 0.5)));
        
        String json = new String(codec.encode(List.of(series)), StandardCharsets.UTF_8);
        
        assertThat(json).startsWith("[")
            .contains("\"labels\":{\"job\":\"api\"}")
            .contains("\"values\":[{\"timestamp\":1000,\"value\":\"0.5\"}]");
    }
    
    @Test
    @DisplayName("Should decode what it encoded")
    void shouldDecodeEncodedSeries() {
        Series series = new Series(Map.of("job", "api"), List.of(new Point(1000, 0.5), new Point(2000, Double.NaN)));
        
        List<Series> decoded = codec.decode(codec.encode(List.of(series)));
        
        assertThat(decoded).hasSize(1);
        assertThat(decoded.get(0).getLabels()).isEqualTo(Map.of("job", "api"));
        assertThat(decoded.get(0).getPoints()).containsExactly(new Point(1000, 0.5), new Point(2000, Double.NaN));
    }
    
    @Test
    @DisplayName("Should decode JSON null as no series")
    void shouldDecodeNullAsEmpty() {
        assertThat(codec.decode("null".getBytes(StandardCharsets.UTF_8))).isEmpty();
    }
    
    @Test
    @DisplayName("Should reject empty and malformed payloads")
    void shouldRejectInvalidPayloads() {
        assertThatThrownBy(() -> codec.decode(new byte[0])).isInstanceOf(CacheAccessException.class);
        assertThatThrownBy(() -> codec.decode(null)).isInstanceOf(CacheAccessException.class);
        assertThatThrownBy(() -> codec.decode("{\"labels\":".getBytes(StandardCharsets.UTF_8)))
            .isInstanceOf(CacheAccessException.class);
    }
}
