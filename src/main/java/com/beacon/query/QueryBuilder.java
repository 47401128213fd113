package com.beacon.query;

import com.beacon.domain.AttributeKey;
import com.beacon.domain.BuilderQuery;
import com.beacon.domain.CompositeQuery;
import com.beacon.domain.DataSource;
import com.beacon.domain.QueryRangeParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns builder queries into query text by dispatching each one to the
 * {@link QueryTranslator} registered for its data source.
 */
public class QueryBuilder {
    
    private static final Logger log = LoggerFactory.getLogger(QueryBuilder.class);
    
    private final Map<DataSource, QueryTranslator> translators = new EnumMap<>(DataSource.class);
    
    public QueryBuilder(List<QueryTranslator> translators) {
        for (QueryTranslator translator : translators) {
            this.translators.put(translator.getDataSource(), translator);
        }
        log.info("QueryBuilder initialized with translators for {}", this.translators.keySet());
    }
    
    /**
     * Translate every enabled final builder query of the request over the
     * request window.
     * 
     * @return query text by query name
     * @throws TranslationException on the first query that cannot be translated
     */
    public Map<String, String> prepareQueries(QueryRangeParams params, Map<String, AttributeKey> attributeKeys) {
        Map<String, String> queries = new LinkedHashMap<>();
        CompositeQuery compositeQuery = params.getCompositeQuery();
        if (compositeQuery == null) {
            return queries;
        }
        
        for (Map.Entry<String, BuilderQuery> entry : compositeQuery.getBuilderQueries().entrySet()) {
            BuilderQuery query = entry.getValue();
            if (!entry.getKey().equals(query.getExpression()) || query.isDisabled()) {
                continue;
            }
            String text = prepareQuery(params.getStart(), params.getEnd(), params, query, attributeKeys);
            queries.put(entry.getKey(), text);
        }
        return queries;
    }
    
    /**
     * Translate one builder query restricted to the window [start, end] (ms).
     * 
     * @throws TranslationException if no translator serves the data source or translation fails
     */
    public String prepareQuery(long start, long end, QueryRangeParams params, BuilderQuery query,
                               Map<String, AttributeKey> attributeKeys) {
        QueryTranslator translator = translators.get(query.getDataSource());
        if (translator == null) {
            throw new TranslationException("unsupported data source " + query.getDataSource(),
                query.getQueryName());
        }
        
        CompositeQuery compositeQuery = params.getCompositeQuery();
        try {
            return translator.translate(start, end, compositeQuery.getQueryType(),
                compositeQuery.getPanelType(), query, attributeKeys);
        } catch (TranslationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TranslationException("failed to prepare query", query.getQueryName(), e);
        }
    }
}
