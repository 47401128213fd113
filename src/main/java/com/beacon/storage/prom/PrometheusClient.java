package com.beacon.storage.prom;

import com.beacon.query.PromRangeQuery;
import com.beacon.query.QueryExecutionException;
import com.beacon.query.ResourceLimitException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Client for the range query endpoint of a Prometheus compatible HTTP API.
 * 
 * Features:
 * - Form encoded POST to /api/v1/query_range, so long queries fit
 * - Circuit breaker so an unavailable engine fails fast
 * - Per-call timeout
 * - Engine timeouts and sample limits reported as resource limit errors
 */
@Component
public class PrometheusClient {
    
    private static final Logger log = LoggerFactory.getLogger(PrometheusClient.class);
    
    private static final String QUERY_RANGE_PATH = "/api/v1/query_range";
    
    private final WebClient webClient;
    private final CircuitBreaker circuitBreaker;
    private final Duration timeout;
    
    @Autowired
    public PrometheusClient(
            WebClient.Builder webClientBuilder,
            @Value("${beacon.prometheus.url:http://localhost:9090}") String baseUrl,
            @Value("${beacon.prometheus.timeout:30s}") Duration timeout) {
        this(webClientBuilder.baseUrl(baseUrl).build(), timeout);
        log.info("PrometheusClient initialized for {}", baseUrl);
    }
    
    public PrometheusClient(WebClient webClient, Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout;
        
        // Opens when half of the last 20 calls failed, half-open after 30 seconds
        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .slidingWindowSize(20)
            .minimumNumberOfCalls(10)
            .ignoreExceptions(ResourceLimitException.class)
            .build();
        
        this.circuitBreaker = CircuitBreaker.of("prometheus", cbConfig);
    }
    
    /**
     * Evaluate a range query
     * 
     * @return the data section of the response
     */
    public Mono<PromQueryResult> queryRange(PromRangeQuery query) {
        log.debug("Executing PromQL range query: {}", query);
        
        return webClient.post()
            .uri(QUERY_RANGE_PATH)
            .contentType(MediaType.APPLICATION_FORM_URLENCODED)
            .body(BodyInserters.fromFormData("query", query.getQuery())
                .with("start", toSeconds(query.getStart()))
                .with("end", toSeconds(query.getEnd()))
                .with("step", Long.toString(query.getStep().getSeconds())))
            .exchangeToMono(response -> response.bodyToMono(PromQueryResponse.class)
                .switchIfEmpty(Mono.error(() -> new QueryExecutionException(
                    "empty response from prometheus, status " + response.rawStatusCode()))))
            .flatMap(response -> toResult(response, query))
            .timeout(timeout)
            .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
            .doOnError(e -> log.warn("PromQL range query failed: {}", e.getMessage()));
    }
    
    private Mono<PromQueryResult> toResult(PromQueryResponse response, PromRangeQuery query) {
        if (response.isSuccess() && response.getData() != null) {
            return Mono.just(response.getData());
        }
        
        String error = response.getError() != null ? response.getError() : "unknown error";
        if ("timeout".equals(response.getErrorType())) {
            return Mono.error(new ResourceLimitException(ResourceLimitException.TIME_LIMIT_MESSAGE,
                new QueryExecutionException(error)));
        }
        if (error.contains("too many samples")) {
            return Mono.error(new ResourceLimitException(ResourceLimitException.BYTES_LIMIT_MESSAGE,
                new QueryExecutionException(error)));
        }
        return Mono.error(new QueryExecutionException(
            "prometheus " + response.getErrorType() + " error: " + error, null, query.getQuery(), null));
    }
    
    private static String toSeconds(Instant instant) {
        return BigDecimal.valueOf(instant.toEpochMilli(), 3).toPlainString();
    }
}
