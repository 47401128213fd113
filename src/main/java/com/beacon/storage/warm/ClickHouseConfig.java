package com.beacon.storage.warm;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Pooled ClickHouse connections for builder and raw SQL queries.
 *
 * The pool should be at least as large as beacon.querier.max-concurrent-queries,
 * since every sub-query of a request holds one connection while it runs.
 */
@Configuration
public class ClickHouseConfig {
    private static final Logger logger = LoggerFactory.getLogger(ClickHouseConfig.class);

    @Value("${beacon.storage.clickhouse.url:jdbc:clickhouse://localhost:8123/signals}")
    private String jdbcUrl;

    @Value("${beacon.storage.clickhouse.username:default}")
    private String user;

    @Value("${beacon.storage.clickhouse.password:}")
    private String password;

    @Value("${beacon.storage.clickhouse.pool.size:10}")
    private int maxConnections;

    @Value("${beacon.storage.clickhouse.pool.min-idle:2}")
    private int minIdleConnections;

    @Value("${beacon.storage.clickhouse.connect-timeout:30s}")
    private Duration connectTimeout;

    @Value("${beacon.storage.clickhouse.max-execution-time:300}")
    private int maxExecutionTimeSeconds;

    @Value("${beacon.storage.clickhouse.compress:true}")
    private boolean compress;

    @Bean(name = "clickHouseDataSource")
    public DataSource clickHouseDataSource() {
        HikariConfig pool = new HikariConfig();
        pool.setPoolName("beacon-clickhouse");
        pool.setDriverClassName("com.clickhouse.jdbc.ClickHouseDriver");
        pool.setJdbcUrl(jdbcUrl);
        pool.setUsername(user);
        pool.setPassword(password);
        pool.setMaximumPoolSize(maxConnections);
        pool.setMinimumIdle(Math.min(minIdleConnections, maxConnections));
        pool.setConnectionTimeout(connectTimeout.toMillis());
        pool.setIdleTimeout(Duration.ofMinutes(10).toMillis());
        pool.setMaxLifetime(Duration.ofMinutes(30).toMillis());

        // socket timeout outlives the server side limit
        pool.addDataSourceProperty("max_execution_time", String.valueOf(maxExecutionTimeSeconds));
        pool.addDataSourceProperty("socket_timeout",
            String.valueOf(Duration.ofSeconds(maxExecutionTimeSeconds + 5L).toMillis()));
        pool.addDataSourceProperty("compress", String.valueOf(compress));

        try {
            HikariDataSource dataSource = new HikariDataSource(pool);
            logger.info("ClickHouse pool {} ready: url={}, maxConnections={}, maxExecutionTime={}s",
                pool.getPoolName(), jdbcUrl, maxConnections, maxExecutionTimeSeconds);
            return dataSource;
        } catch (RuntimeException e) {
            logger.error("Failed to open ClickHouse pool for {}", jdbcUrl, e);
            throw new IllegalStateException("ClickHouse DataSource initialization failed", e);
        }
    }

    @Bean(name = "clickHouseJdbcTemplate")
    public JdbcTemplate clickHouseJdbcTemplate(@Qualifier("clickHouseDataSource") DataSource clickHouseDataSource) {
        JdbcTemplate template = new JdbcTemplate(clickHouseDataSource);
        template.setQueryTimeout(maxExecutionTimeSeconds);
        return template;
    }
}
