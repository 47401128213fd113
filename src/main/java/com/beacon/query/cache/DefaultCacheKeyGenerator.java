package com.beacon.query.cache;

import com.beacon.domain.AttributeKey;
import com.beacon.domain.BuilderQuery;
import com.beacon.domain.CompositeQuery;
import com.beacon.domain.DataSource;
import com.beacon.domain.FilterItem;
import com.beacon.domain.PanelType;
import com.beacon.domain.PromQuery;
import com.beacon.domain.QueryRangeParams;
import com.beacon.domain.QueryType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Cache key generator for graph panels.
 * 
 * Keys never include the request window, so consecutive requests for
 * overlapping windows share an entry and only the missing part is fetched.
 * 
 * - PromQL queries are keyed by their query text
 * - Final metrics builder queries are keyed by source, step, aggregation,
 *   filters and group by
 * - Other panel types and data sources are not cached
 */
@Component
public class DefaultCacheKeyGenerator implements CacheKeyGenerator {
    
    private static final Logger log = LoggerFactory.getLogger(DefaultCacheKeyGenerator.class);
    
    @Override
    public Map<String, String> generateKeys(QueryRangeParams params) {
        Map<String, String> keys = new HashMap<>();
        CompositeQuery compositeQuery = params.getCompositeQuery();
        if (compositeQuery == null || compositeQuery.getPanelType() != PanelType.GRAPH) {
            return keys;
        }
        
        if (compositeQuery.getQueryType() == QueryType.PROMQL) {
            for (Map.Entry<String, PromQuery> entry : compositeQuery.getPromQueries().entrySet()) {
                keys.put(entry.getKey(), entry.getValue().getQuery());
            }
            return keys;
        }
        
        for (Map.Entry<String, BuilderQuery> entry : compositeQuery.getBuilderQueries().entrySet()) {
            String queryName = entry.getKey();
            BuilderQuery query = entry.getValue();
            if (queryName.equals(query.getExpression()) && query.getDataSource() == DataSource.METRICS) {
                keys.put(queryName, builderQueryKey(query));
            }
        }
        
        log.trace("Generated {} cache keys", keys.size());
        return keys;
    }
    
    private String builderQueryKey(BuilderQuery query) {
        List<String> parts = new ArrayList<>();
        parts.add("source=" + query.getDataSource());
        parts.add("step=" + query.getStepInterval());
        parts.add("aggregate=" + query.getAggregateOperator());
        
        AttributeKey aggregateAttribute = query.getAggregateAttribute();
        if (aggregateAttribute != null && aggregateAttribute.getKey() != null
                && !aggregateAttribute.getKey().isEmpty()) {
            parts.add("aggregateAttribute=" + aggregateAttribute.cacheKey());
        }
        
        if (query.getFilters() != null) {
            List<FilterItem> items = query.getFilters().getItems();
            for (int idx = 0; idx < items.size(); idx++) {
                parts.add("filter-" + idx + "=" + items.get(idx).cacheKey());
            }
        }
        
        List<AttributeKey> groupBy = query.getGroupBy();
        for (int idx = 0; idx < groupBy.size(); idx++) {
            parts.add("groupBy-" + idx + "=" + groupBy.get(idx).cacheKey());
        }
        
        return String.join("&", parts);
    }
}
