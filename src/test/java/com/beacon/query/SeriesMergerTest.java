package com.beacon.query;

import com.beacon.domain.Point;
import com.beacon.domain.Series;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SeriesMerger Tests")
class SeriesMergerTest {
    
    private final SeriesMerger merger = new SeriesMerger();
    
    @Test
    @DisplayName("Merging with nothing should only sort and de-duplicate")
    void mergeWithEmptyShouldNormalize() {
        List<Series> input = List.of(series(Map.of("a", "1"), point(3, 3), point(1, 1), point(3, 30)));
        
        List<Series> cachedOnly = merger.merge(input, List.of());
        List<Series> missedOnly = merger.merge(List.of(), input);
        
        assertThat(cachedOnly).hasSize(1);
        assertThat(cachedOnly.get(0).getPoints()).containsExactly(point(1, 1), point(3, 30));
        assertThat(missedOnly).hasSize(1);
        assertThat(missedOnly.get(0).getPoints()).containsExactly(point(1, 1), point(3, 30));
    }
    
    @Test
    @DisplayName("Same labels with disjoint ranges should give the sorted union")
    void disjointRangesShouldUnion() {
        List<Series> cached = List.of(series(Map.of("a", "1"), point(1, 1), point(2, 2)));
        List<Series> missed = List.of(series(Map.of("a", "1"), point(5, 5), point(4, 4)));
        
        List<Series> merged = merger.merge(cached, missed);
        
        assertThat(merged).hasSize(1);
        assertThat(merged.get(0).getPoints()).containsExactly(point(1, 1), point(2, 2), point(4, 4), point(5, 5));
    }
    
    @Test
    @DisplayName("Overlapping timestamps should not be duplicated and fetched data should win")
    void overlapShouldPreferFetchedPoint() {
        List<Series> cached = List.of(series(Map.of("a", "1"), point(1, 1), point(2, 2), point(3, 3)));
        List<Series> missed = List.of(series(Map.of("a", "1"), point(3, 300), point(4, 4)));
        
        List<Series> merged = merger.merge(cached, missed);
        
        assertThat(merged).hasSize(1);
        assertThat(merged.get(0).getPoints()).containsExactly(point(1, 1), point(2, 2), point(3, 300), point(4, 4));
    }
    
    @Test
    @DisplayName("Different label sets should stay separate series")
    void differentLabelsShouldStaySeparate() {
        List<Series> cached = List.of(series(Map.of("a", "1"), point(1, 1)));
        List<Series> missed = List.of(series(Map.of("a", "2"), point(1, 10)), series(Map.of("a", "1"), point(2, 2)));
        
        List<Series> merged = merger.merge(cached, missed);
        
        assertThat(merged).hasSize(2);
        assertThat(merged).filteredOn(s -> s.getLabels().get("a").equals("1"))
            .singleElement()
            .satisfies(s -> assertThat(s.getPoints()).containsExactly(point(1, 1), point(2, 2)));
        assertThat(merged).filteredOn(s -> s.getLabels().get("a").equals("2"))
            .singleElement()
            .satisfies(s -> assertThat(s.getPoints()).containsExactly(point(1, 10)));
    }
    
    @Test
    @DisplayName("Inputs should not be modified")
    void inputsShouldNotBeModified() {
        Series cachedSeries = series(Map.of("a", "1"), point(2, 2), point(1, 1));
        Series missedSeries = series(Map.of("a", "1"), point(3, 3));
        
        merger.merge(List.of(cachedSeries), List.of(missedSeries));
        
        assertThat(cachedSeries.getPoints()).containsExactly(point(2, 2), point(1, 1));
        assertThat(missedSeries.getPoints()).containsExactly(point(3, 3));
    }
    
    private static Series series(Map<String, String> labels, Point... points) {
        return new Series(labels, new ArrayList<>(List.of(points)));
    }
    
    private static Point point(long timestamp, double value) {
        return new Point(timestamp, value);
    }
}
