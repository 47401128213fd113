package com.beacon.query;

import com.beacon.domain.Series;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges cached series with freshly fetched series.
 * 
 * Series are matched by label signature. Points of a fetched series are
 * appended to the cached series with the same labels, then every series is
 * sorted by timestamp and de-duplicated. For points sharing a timestamp the
 * fetched point wins over the cached one, and a later fetched point over an
 * earlier one.
 * 
 * Inputs are copied, not modified. The order of the returned series is not
 * specified.
 */
public class SeriesMerger {
    
    public List<Series> merge(List<Series> cachedSeries, List<Series> missedSeries) {
        Map<String, Series> seriesByLabels = new LinkedHashMap<>();
        
        for (Series series : cachedSeries) {
            // a repeated label set in the cached data keeps the last one
            seriesByLabels.put(series.labelSignature(), series.copy());
        }
        
        for (Series series : missedSeries) {
            String signature = series.labelSignature();
            Series existing = seriesByLabels.get(signature);
            if (existing == null) {
                seriesByLabels.put(signature, series.copy());
            } else {
                existing.addPoints(series.getPoints());
            }
        }
        
        List<Series> merged = new ArrayList<>(seriesByLabels.size());
        for (Series series : seriesByLabels.values()) {
            series.sortPoints();
            series.removeDuplicatePoints();
            merged.add(series);
        }
        return merged;
    }
}
