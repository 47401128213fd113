package com.beacon.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;

import java.util.Objects;

/**
 * A single sample of a time series.
 * 
 * The value is serialized as a decimal string so that NaN and infinite
 * values survive a round trip through the cache; numeric JSON values are
 * accepted on read as well.
 */
public final class Point {
    
    private final long timestamp;
    private final double value;
    
    public Point(long timestamp, double value) {
        this.timestamp = timestamp;
        this.value = value;
    }
    
    @JsonCreator
    static Point fromJson(@JsonProperty("timestamp") long timestamp,
                          @JsonProperty("value") String value) {
        return new Point(timestamp, value == null ? 0.0 : Double.parseDouble(value));
    }
    
    /**
     * Timestamp in epoch milliseconds
     */
    @JsonProperty("timestamp")
    public long getTimestamp() {
        return timestamp;
    }
    
    @JsonProperty("value")
    @JsonSerialize(using = ToStringSerializer.class)
    public double getValue() {
        return value;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Point)) {
            return false;
        }
        Point other = (Point) o;
        return timestamp == other.timestamp
            && Double.compare(value, other.value) == 0;
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }
    
    @Override
    public String toString() {
        return "Point{timestamp=" + timestamp + ", value=" + value + "}";
    }
}
