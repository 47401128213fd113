package com.beacon.storage.warm;

import com.beacon.domain.Point;
import com.beacon.domain.Row;
import com.beacon.domain.Series;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs SQL against ClickHouse and shapes the result set into series or rows.
 * 
 * Time series result sets are read column by column:
 * - {@code ts} or {@code interval}: the point timestamp
 * - a numeric column named like a result alias ({@code value}, {@code result},
 *   {@code res}, {@code __value}, {@code __result}), or the only numeric
 *   column: the point value
 * - anything else: a label
 * Rows with the same labels form one series.
 * 
 * JDBC calls block, so they run on the bounded elastic scheduler.
 */
@Repository
public class ClickHouseRepository {
    private static final Logger logger = LoggerFactory.getLogger(ClickHouseRepository.class);
    
    private static final Set<String> TIMESTAMP_COLUMNS = Set.of("ts", "interval");
    private static final Set<String> VALUE_COLUMNS = Set.of("__result", "__value", "result", "res", "value");
    private static final String ROW_TIMESTAMP_COLUMN = "timestamp";
    
    private static final ResultSetExtractor<List<Series>> SERIES_EXTRACTOR = ClickHouseRepository::readTimeSeries;
    private static final ResultSetExtractor<List<Row>> ROW_EXTRACTOR = ClickHouseRepository::readRows;
    
    private final JdbcTemplate jdbcTemplate;
    
    public ClickHouseRepository(@Qualifier("clickHouseJdbcTemplate") JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }
    
    /**
     * Execute a query returning time series rows
     */
    public Mono<List<Series>> queryTimeSeries(String sql) {
        return Mono.fromCallable(() -> {
            long startQuery = System.currentTimeMillis();
            List<Series> series = jdbcTemplate.query(sql, SERIES_EXTRACTOR);
            logger.debug("Time series query returned {} series in {} ms",
                series != null ? series.size() : 0, System.currentTimeMillis() - startQuery);
            return series != null ? series : new ArrayList<Series>();
        })
        .subscribeOn(Schedulers.boundedElastic())
        .onErrorMap(e -> ClickHouseErrors.translate(e, sql));
    }
    
    /**
     * Execute a query returning raw rows
     */
    public Mono<List<Row>> queryRows(String sql) {
        return Mono.fromCallable(() -> {
            long startQuery = System.currentTimeMillis();
            List<Row> rows = jdbcTemplate.query(sql, ROW_EXTRACTOR);
            logger.debug("List query returned {} rows in {} ms",
                rows != null ? rows.size() : 0, System.currentTimeMillis() - startQuery);
            return rows != null ? rows : new ArrayList<Row>();
        })
        .subscribeOn(Schedulers.boundedElastic())
        .onErrorMap(e -> ClickHouseErrors.translate(e, sql));
    }
    
    static List<Series> readTimeSeries(ResultSet rs) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        int columnCount = metaData.getColumnCount();
        
        int numericColumns = 0;
        for (int i = 1; i <= columnCount; i++) {
            if (!TIMESTAMP_COLUMNS.contains(metaData.getColumnLabel(i)) && isNumeric(metaData.getColumnType(i))) {
                numericColumns++;
            }
        }
        
        Map<String, Series> seriesBySignature = new LinkedHashMap<>();
        while (rs.next()) {
            Map<String, String> labels = new HashMap<>();
            long timestamp = 0;
            double value = 0;
            
            for (int i = 1; i <= columnCount; i++) {
                String columnName = metaData.getColumnLabel(i);
                Object columnValue = rs.getObject(i);
                
                if (TIMESTAMP_COLUMNS.contains(columnName) && columnValue != null) {
                    timestamp = toEpochMillis(columnValue);
                } else if (columnValue instanceof Number
                        && (VALUE_COLUMNS.contains(columnName) || numericColumns == 1)) {
                    value = ((Number) columnValue).doubleValue();
                } else {
                    labels.put(columnName, columnValue == null ? "" : String.valueOf(columnValue));
                }
            }
            
            Series candidate = new Series(labels, null);
            Series series = seriesBySignature.computeIfAbsent(candidate.labelSignature(), key -> candidate);
            series.addPoint(new Point(timestamp, value));
        }
        
        return new ArrayList<>(seriesBySignature.values());
    }
    
    static List<Row> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        int columnCount = metaData.getColumnCount();
        
        List<Row> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> data = new HashMap<>();
            Instant timestamp = null;
            
            for (int i = 1; i <= columnCount; i++) {
                String columnName = metaData.getColumnLabel(i);
                Object value = rs.getObject(i);
                
                if (ROW_TIMESTAMP_COLUMN.equals(columnName) && value != null) {
                    timestamp = toInstant(value);
                }
                
                // Handle special types
                if (value instanceof java.sql.Timestamp) {
                    value = ((java.sql.Timestamp) value).toInstant().toString();
                } else if (value instanceof java.sql.Date) {
                    value = ((java.sql.Date) value).toLocalDate().toString();
                } else if (value instanceof java.sql.Array) {
                    value = ((java.sql.Array) value).getArray();
                }
                
                data.put(columnName, value);
            }
            
            rows.add(new Row(timestamp, data));
        }
        return rows;
    }
    
    /**
     * Numeric timestamps of time series rows are epoch milliseconds
     */
    private static long toEpochMillis(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return toInstant(value).toEpochMilli();
    }
    
    /**
     * Numeric timestamps of list rows are epoch nanoseconds
     */
    private static Instant toInstant(Object value) {
        if (value instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) value).toInstant();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        }
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof Number) {
            long nanos = ((Number) value).longValue();
            return Instant.ofEpochSecond(0, nanos);
        }
        return Instant.parse(value.toString());
    }
    
    private static boolean isNumeric(int sqlType) {
        switch (sqlType) {
            case java.sql.Types.TINYINT:
            case java.sql.Types.SMALLINT:
            case java.sql.Types.INTEGER:
            case java.sql.Types.BIGINT:
            case java.sql.Types.FLOAT:
            case java.sql.Types.REAL:
            case java.sql.Types.DOUBLE:
            case java.sql.Types.NUMERIC:
            case java.sql.Types.DECIMAL:
                return true;
            default:
                return false;
        }
    }
}
