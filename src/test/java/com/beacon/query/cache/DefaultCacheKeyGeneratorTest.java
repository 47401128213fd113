package com.beacon.query.cache;

import com.beacon.domain.AttributeKey;
import com.beacon.domain.BuilderQuery;
import com.beacon.domain.CompositeQuery;
import com.beacon.domain.DataSource;
import com.beacon.domain.FilterItem;
import com.beacon.domain.FilterSet;
import com.beacon.domain.PanelType;
import com.beacon.domain.PromQuery;
import com.beacon.domain.QueryRangeParams;
import com.beacon.domain.QueryType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DefaultCacheKeyGenerator Tests")
class DefaultCacheKeyGeneratorTest {
    
    private final DefaultCacheKeyGenerator generator = new DefaultCacheKeyGenerator();
    
    @Test
    @DisplayName("Should key PromQL queries by their text")
    void shouldKeyPromQueriesByText() {
        CompositeQuery compositeQuery = new CompositeQuery(QueryType.PROMQL, PanelType.GRAPH);
        compositeQuery.getPromQueries().put("A", new PromQuery("up"));
        compositeQuery.getPromQueries().put("B", new PromQuery("rate(errors[5m])"));
        
        Map<String, String> keys = generator.generateKeys(params(compositeQuery));
        
        assertThat(keys).containsExactlyInAnyOrderEntriesOf(Map.of("A", "up", "B", "rate(errors[5m])"));
    }
    
    @Test
    @DisplayName("Should key metrics builder queries by their definition")
    void shouldKeyMetricsBuilderQueries() {
        CompositeQuery compositeQuery = new CompositeQuery(QueryType.BUILDER, PanelType.GRAPH);
        BuilderQuery query = new BuilderQuery("A", DataSource.METRICS, 60);
        query.setAggregateOperator("sum_rate");
        query.setAggregateAttribute(new AttributeKey("http_requests", "float64", "", true));
        AttributeKey service = new AttributeKey("service", "string", "tag", false);
        query.setFilters(new FilterSet("AND", List.of(new FilterItem(service, "api", "="))));
        query.setGroupBy(List.of(service));
        compositeQuery.getBuilderQueries().put("A", query);
        
        Map<String, String> keys = generator.generateKeys(params(compositeQuery));
        
        assertThat(keys).containsOnlyKeys("A");
        assertThat(keys.get("A")).isEqualTo(
            "source=metrics&step=60&aggregate=sum_rate"
                + "&aggregateAttribute=key:http_requests,dataType:float64,type:,isColumn:true"
                + "&filter-0=key:key:service,dataType:string,type:tag,isColumn:false,op:=,value:api"
                + "&groupBy-0=key:service,dataType:string,type:tag,isColumn:false");
    }
    
    @Test
    @DisplayName("Should give different keys to different step intervals")
    void shouldIncludeStep() {
        CompositeQuery oneMinute = new CompositeQuery(QueryType.BUILDER, PanelType.GRAPH);
        oneMinute.getBuilderQueries().put("A", new BuilderQuery("A", DataSource.METRICS, 60));
        CompositeQuery fiveMinutes = new CompositeQuery(QueryType.BUILDER, PanelType.GRAPH);
        fiveMinutes.getBuilderQueries().put("A", new BuilderQuery("A", DataSource.METRICS, 300));
        
        assertThat(generator.generateKeys(params(oneMinute)).get("A"))
            .isNotEqualTo(generator.generateKeys(params(fiveMinutes)).get("A"));
    }
    
    @Test
    @DisplayName("Should not key logs, traces or intermediate queries")
    void shouldSkipUncachedBuilderQueries() {
        CompositeQuery compositeQuery = new CompositeQuery(QueryType.BUILDER, PanelType.GRAPH);
        compositeQuery.getBuilderQueries().put("A", new BuilderQuery("A", DataSource.LOGS, 60));
        compositeQuery.getBuilderQueries().put("B", new BuilderQuery("B", DataSource.TRACES, 60));
        BuilderQuery intermediate = new BuilderQuery("C", DataSource.METRICS, 60);
        intermediate.setExpression("C * 2");
        compositeQuery.getBuilderQueries().put("C", intermediate);
        
        assertThat(generator.generateKeys(params(compositeQuery))).isEmpty();
    }
    
    @Test
    @DisplayName("Should not key panels other than graphs")
    void shouldSkipNonGraphPanels() {
        CompositeQuery compositeQuery = new CompositeQuery(QueryType.PROMQL, PanelType.VALUE);
        compositeQuery.getPromQueries().put("A", new PromQuery("up"));
        
        assertThat(generator.generateKeys(params(compositeQuery))).isEmpty();
        assertThat(generator.generateKeys(params(null))).isEmpty();
    }
    
    private static QueryRangeParams params(CompositeQuery compositeQuery) {
        return new QueryRangeParams(0, 3_600_000, 60, compositeQuery);
    }
}
