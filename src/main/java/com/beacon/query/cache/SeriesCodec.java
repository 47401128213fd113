package com.beacon.query.cache;

import com.beacon.domain.Series;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON encoding of the series snapshots kept in the query cache
 */
@Component
public class SeriesCodec {
    
    private static final TypeReference<List<Series>> SERIES_LIST = new TypeReference<>() {};
    
    private final ObjectMapper objectMapper;
    
    public SeriesCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }
    
    public byte[] encode(List<Series> series) {
        try {
            return objectMapper.writeValueAsBytes(series);
        } catch (JsonProcessingException e) {
            throw new CacheAccessException("Failed to encode series for cache", e);
        }
    }
    
    /**
     * @throws CacheAccessException if the payload is absent or not a JSON array of series
     */
    public List<Series> decode(byte[] data) {
        if (data == null || data.length == 0) {
            throw new CacheAccessException("Cached payload is empty");
        }
        try {
            List<Series> series = objectMapper.readValue(data, SERIES_LIST);
            return series != null ? series : new ArrayList<>();
        } catch (IOException e) {
            throw new CacheAccessException("Failed to decode cached series", e);
        }
    }
}
