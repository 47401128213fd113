package com.beacon.query;

import com.beacon.domain.AttributeKey;
import com.beacon.domain.BuilderQuery;
import com.beacon.domain.DataSource;
import com.beacon.domain.PanelType;
import com.beacon.domain.QueryType;

import java.util.Map;

/**
 * Translates builder queries of one data source into ClickHouse SQL.
 * Implementations live with the data source they serve.
 */
public interface QueryTranslator {
    
    DataSource getDataSource();
    
    /**
     * Build the SQL for the window [start, end] (ms).
     * 
     * @throws TranslationException if the query cannot be expressed
     */
    String translate(long start, long end, QueryType queryType, PanelType panelType,
                     BuilderQuery query, Map<String, AttributeKey> attributeKeys);
}
