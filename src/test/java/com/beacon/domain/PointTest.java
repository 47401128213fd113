package com.beacon.domain;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Point Tests")
class PointTest {
    
    private final ObjectMapper objectMapper = new ObjectMapper();
    
    @Test
    @DisplayName("Should write the value as a decimal string")
    void shouldWriteValueAsString() throws Exception {
        String json = objectMapper.writeValueAsString(new Point(1000L, 2.5));
        
        assertThat(json).contains("\"timestamp\":1000").contains("\"value\":\"2.5\"");
    }
    
    @Test
    @DisplayName("Should keep NaN through a JSON round trip")
    void shouldKeepNaN() throws Exception {
        String json = objectMapper.writeValueAsString(new Point(1000L, Double.NaN));
        
        Point point = objectMapper.readValue(json, Point.class);
        
        assertThat(point.getTimestamp()).isEqualTo(1000L);
        assertThat(point.getValue()).isNaN();
    }
    
    @Test
    @DisplayName("Should accept numeric values on read")
    void shouldAcceptNumericValue() throws Exception {
        Point point = objectMapper.readValue("{\"timestamp\":5,\"value\":3.25}", Point.class);
        
        assertThat(point).isEqualTo(new Point(5L, 3.25));
    }
}
