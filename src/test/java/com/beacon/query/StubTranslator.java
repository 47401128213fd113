package com.beacon.query;

import com.beacon.domain.AttributeKey;
import com.beacon.domain.BuilderQuery;
import com.beacon.domain.DataSource;
import com.beacon.domain.PanelType;
import com.beacon.domain.QueryType;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Translator writing "source:name:start:end", failing for selected query names
 */
class StubTranslator implements QueryTranslator {
    
    private final DataSource dataSource;
    private final Set<String> failing = new HashSet<>();
    
    StubTranslator(DataSource dataSource, String... failingQueries) {
        this.dataSource = dataSource;
        this.failing.addAll(Set.of(failingQueries));
    }
    
    static String sql(DataSource dataSource, String queryName, long start, long end) {
        return dataSource + ":" + queryName + ":" + start + ":" + end;
    }
    
    @Override
    public DataSource getDataSource() {
        return dataSource;
    }
    
    @Override
    public String translate(long start, long end, QueryType queryType, PanelType panelType,
                            BuilderQuery query, Map<String, AttributeKey> attributeKeys) {
        if (failing.contains(query.getQueryName())) {
            throw new IllegalArgumentException("unknown attribute in " + query.getQueryName());
        }
        return sql(dataSource, query.getQueryName(), start, end);
    }
}
