package com.beacon.query;

import com.beacon.domain.BuilderQuery;
import com.beacon.domain.CompositeQuery;
import com.beacon.domain.DataSource;
import com.beacon.domain.PanelType;
import com.beacon.domain.QueryRangeParams;
import com.beacon.domain.QueryType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("QueryBuilder Tests")
class QueryBuilderTest {
    
    private final QueryBuilder queryBuilder = new QueryBuilder(List.of(
        new StubTranslator(DataSource.LOGS, "broken"),
        new StubTranslator(DataSource.METRICS)));
    
    @Test
    @DisplayName("Should translate final queries over the request window")
    void shouldPrepareFinalQueries() {
        CompositeQuery compositeQuery = new CompositeQuery(QueryType.BUILDER, PanelType.LIST);
        compositeQuery.getBuilderQueries().put("A", new BuilderQuery("A", DataSource.LOGS, 60));
        BuilderQuery intermediate = new BuilderQuery("B", DataSource.METRICS, 60);
        intermediate.setExpression("A / B");
        compositeQuery.getBuilderQueries().put("B", intermediate);
        compositeQuery.getBuilderQueries().put("C", new BuilderQuery("C", DataSource.METRICS, 60));
        
        Map<String, String> queries = queryBuilder.prepareQueries(
            new QueryRangeParams(1000, 2000, 60, compositeQuery), Map.of());
        
        assertThat(queries).containsOnlyKeys("A", "C");
        assertThat(queries.get("A")).isEqualTo(StubTranslator.sql(DataSource.LOGS, "A", 1000, 2000));
        assertThat(queries.get("C")).isEqualTo(StubTranslator.sql(DataSource.METRICS, "C", 1000, 2000));
    }
    
    @Test
    @DisplayName("Should skip disabled queries")
    void shouldSkipDisabledQueries() {
        CompositeQuery compositeQuery = new CompositeQuery(QueryType.BUILDER, PanelType.LIST);
        compositeQuery.getBuilderQueries().put("A", new BuilderQuery("A", DataSource.LOGS, 60));
        BuilderQuery disabled = new BuilderQuery("B", DataSource.LOGS, 60);
        disabled.setDisabled(true);
        compositeQuery.getBuilderQueries().put("B", disabled);
        
        Map<String, String> queries = queryBuilder.prepareQueries(
            new QueryRangeParams(1000, 2000, 60, compositeQuery), Map.of());
        
        assertThat(queries).containsOnlyKeys("A");
    }
    
    @Test
    @DisplayName("Should translate a single query over a sub-window")
    void shouldPrepareQueryForWindow() {
        CompositeQuery compositeQuery = new CompositeQuery(QueryType.BUILDER, PanelType.GRAPH);
        BuilderQuery query = new BuilderQuery("A", DataSource.METRICS, 60);
        
        String sql = queryBuilder.prepareQuery(1500, 2000, new QueryRangeParams(1000, 2000, 60, compositeQuery),
            query, Map.of());
        
        assertThat(sql).isEqualTo(StubTranslator.sql(DataSource.METRICS, "A", 1500, 2000));
    }
    
    @Test
    @DisplayName("Should fail for a data source without translator")
    void shouldFailForUnsupportedDataSource() {
        CompositeQuery compositeQuery = new CompositeQuery(QueryType.BUILDER, PanelType.TRACE);
        compositeQuery.getBuilderQueries().put("A", new BuilderQuery("A", DataSource.TRACES, 60));
        
        assertThatThrownBy(() -> queryBuilder.prepareQueries(new QueryRangeParams(1000, 2000, 60, compositeQuery), Map.of()))
            .isInstanceOf(TranslationException.class)
            .hasMessageContaining("unsupported data source traces");
    }
    
    @Test
    @DisplayName("Should wrap translator failures with the query name")
    void shouldWrapTranslatorFailures() {
        CompositeQuery compositeQuery = new CompositeQuery(QueryType.BUILDER, PanelType.LIST);
        compositeQuery.getBuilderQueries().put("broken", new BuilderQuery("broken", DataSource.LOGS, 60));
        
        assertThatThrownBy(() -> queryBuilder.prepareQueries(new QueryRangeParams(1000, 2000, 60, compositeQuery), Map.of()))
            .isInstanceOf(TranslationException.class)
            .hasMessageContaining("failed to prepare query")
            .hasRootCauseInstanceOf(IllegalArgumentException.class)
            .satisfies(error -> assertThat(((TranslationException) error).getQueryName()).isEqualTo("broken"));
    }
}
