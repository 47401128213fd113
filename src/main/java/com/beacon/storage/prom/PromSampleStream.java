package com.beacon.storage.prom;

import com.beacon.domain.Point;

import java.util.List;
import java.util.Map;

/**
 * One series of a PromQL matrix result
 */
public class PromSampleStream {
    
    private final Map<String, String> metric;
    private final List<Point> points;
    
    public PromSampleStream(Map<String, String> metric, List<Point> points) {
        this.metric = metric;
        this.points = points;
    }
    
    public Map<String, String> getMetric() {
        return metric;
    }
    
    public List<Point> getPoints() {
        return points;
    }
}
