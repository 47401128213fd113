package com.beacon.storage.prom;

import com.beacon.domain.Point;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * The {@code data} section of a Prometheus HTTP API query response.
 * 
 * The shape of {@code result} depends on {@code resultType}; range queries
 * yield a matrix, read with {@link #matrix()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromQueryResult {
    
    public static final String MATRIX = "matrix";
    
    @JsonProperty("resultType")
    private String resultType;
    
    @JsonProperty("result")
    private JsonNode result;
    
    public PromQueryResult() {
    }
    
    public PromQueryResult(String resultType, JsonNode result) {
        this.resultType = resultType;
        this.result = result;
    }
    
    public String getResultType() {
        return resultType;
    }
    
    public JsonNode getResult() {
        return result;
    }
    
    /**
     * Read the result as a matrix. Sample timestamps are converted from
     * fractional seconds to milliseconds.
     * 
     * @throws IllegalStateException if the result is not a matrix
     */
    public List<PromSampleStream> matrix() {
        if (!MATRIX.equals(resultType)) {
            throw new IllegalStateException("value type is not matrix: " + resultType);
        }
        List<PromSampleStream> streams = new ArrayList<>();
        if (result == null || !result.isArray()) {
            return streams;
        }
        for (JsonNode stream : result) {
            Map<String, String> metric = new HashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = stream.path("metric").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                metric.put(field.getKey(), field.getValue().asText());
            }
            
            List<Point> points = new ArrayList<>();
            for (JsonNode sample : stream.path("values")) {
                long timestamp = Math.round(sample.get(0).asDouble() * 1000);
                double value = Double.parseDouble(sample.get(1).asText());
                points.add(new Point(timestamp, value));
            }
            streams.add(new PromSampleStream(metric, points));
        }
        return streams;
    }
}
