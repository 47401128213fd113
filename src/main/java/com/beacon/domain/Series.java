package com.beacon.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * A time series: a label set identifying the series plus its points.
 * 
 * Two series are the same series iff their label maps are equal; the
 * {@link #labelSignature()} gives the canonical string form of that identity.
 * A series is owned by the query unit that produced it and is not safe for
 * concurrent mutation.
 */
public class Series {
    
    @JsonProperty("labels")
    private Map<String, String> labels;
    
    @JsonProperty("values")
    private List<Point> points;
    
    public Series() {
        this.labels = new HashMap<>();
        this.points = new ArrayList<>();
    }
    
    public Series(Map<String, String> labels, List<Point> points) {
        this.labels = labels != null ? new HashMap<>(labels) : new HashMap<>();
        this.points = points != null ? new ArrayList<>(points) : new ArrayList<>();
    }
    
    /**
     * Copy with its own label map and point list
     */
    public Series copy() {
        return new Series(labels, points);
    }
    
    public Map<String, String> getLabels() {
        return labels;
    }
    
    public void setLabels(Map<String, String> labels) {
        this.labels = labels != null ? labels : new HashMap<>();
    }
    
    /**
     * The labels as single-entry maps, ordered by key. Derived from
     * {@link #getLabels()}; ignored when reading JSON.
     */
    @JsonProperty(value = "labelsArray", access = JsonProperty.Access.READ_ONLY)
    public List<Map<String, String>> getLabelsArray() {
        List<Map<String, String>> labelsArray = new ArrayList<>(labels.size());
        for (Map.Entry<String, String> entry : new TreeMap<>(labels).entrySet()) {
            labelsArray.add(Collections.singletonMap(entry.getKey(), entry.getValue()));
        }
        return labelsArray;
    }
    
    public List<Point> getPoints() {
        return points;
    }
    
    public void setPoints(List<Point> points) {
        this.points = points != null ? points : new ArrayList<>();
    }
    
    public void addPoint(Point point) {
        this.points.add(point);
    }
    
    public void addPoints(List<Point> points) {
        this.points.addAll(points);
    }
    
    /**
     * Sort points by timestamp ascending. The sort is stable, so points
     * sharing a timestamp keep their insertion order.
     */
    public void sortPoints() {
        points.sort(Comparator.comparingLong(Point::getTimestamp));
    }
    
    /**
     * Collapse adjacent points with equal timestamps into one. Expects sorted
     * points; of each run of equal timestamps the last point is kept.
     */
    public void removeDuplicatePoints() {
        if (points.size() < 2) {
            return;
        }
        List<Point> deduplicated = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            Point point = points.get(i);
            boolean lastOfRun = i == points.size() - 1
                || points.get(i + 1).getTimestamp() != point.getTimestamp();
            if (lastOfRun) {
                deduplicated.add(point);
            }
        }
        this.points = deduplicated;
    }
    
    /**
     * Canonical form of the label set, keys sorted: {@code {k1=v1,k2=v2}}
     */
    @JsonIgnore
    public String labelSignature() {
        return new TreeMap<>(labels).entrySet().stream()
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .collect(Collectors.joining(",", "{", "}"));
    }
    
    @Override
    public String toString() {
        return "Series{labels=" + labelSignature() + ", points=" + points.size() + "}";
    }
}
