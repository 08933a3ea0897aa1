package com.baskettecase.eventquery.db;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Database Client Factory
 *
 * Builds {@link DatabaseClient}s from connection strings.
 * Static clients get HikariCP pools, shared by the whole process.
 * Request-scoped clients use plain driver connections: the platform that issued the
 * credential pools on its side, and a per-request pool would outlive its credential.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseClientFactory {

    private final MeterRegistry meterRegistry;

    @Value("${eventquery.db.max-pool-size:10}")
    private int maxPoolSize = 10;

    @Value("${eventquery.db.min-idle:2}")
    private int minIdle = 2;

    @Value("${eventquery.db.connection-timeout-ms:30000}")
    private long connectionTimeoutMs = 30000;

    @Value("${eventquery.db.application-name:event-query-core}")
    private String applicationName = "event-query-core";

    /**
     * @param connectionString primary connection string
     * @param replicaConnectionString optional read replica connection string
     * @param requestScoped whether the credential is only valid for the current request
     */
    public DatabaseClient create(String connectionString, String replicaConnectionString, boolean requestScoped) {
        ConnectionUrl primaryUrl = parse(connectionString, requestScoped ? "Request-scoped connection string" : "DATABASE_URL");
        String schema = primaryUrl.schema().orElse(null);

        List<DataSource> dataSources = new ArrayList<>();
        DataSource primaryDataSource = requestScoped
                ? createDriverDataSource(primaryUrl)
                : createPooledDataSource(primaryUrl, applicationName + "-primary", false);
        dataSources.add(primaryDataSource);

        SqlExecutor replica = null;
        if (replicaConnectionString != null && !replicaConnectionString.isBlank()) {
            ConnectionUrl replicaUrl = parse(replicaConnectionString, "DATABASE_REPLICA_URL");
            DataSource replicaDataSource = requestScoped
                    ? createDriverDataSource(replicaUrl)
                    : createPooledDataSource(replicaUrl, applicationName + "-replica", true);
            dataSources.add(replicaDataSource);
            replica = new JdbcSqlExecutor(createJdbcTemplate(replicaDataSource));
        }

        meterRegistry.counter("eventquery.client.created", "mode", requestScoped ? "dynamic" : "static").increment();

        if (replica != null) {
            log.info("✅ Database client initialized (with replica)");
        } else {
            log.info("✅ Database client initialized");
        }

        return new DatabaseClient(
                new JdbcSqlExecutor(createJdbcTemplate(primaryDataSource)),
                replica,
                primaryDataSource,
                dataSources,
                schema,
                requestScoped);
    }

    /**
     * Pool configuration for a static connection string.
     */
    HikariConfig buildHikariConfig(ConnectionUrl url, String poolName, boolean readOnly) {
        HikariConfig config = new HikariConfig();

        config.setJdbcUrl(url.jdbcUrl());
        config.setUsername(url.username());
        config.setPassword(url.password());
        config.setPoolName(poolName);

        config.setMaximumPoolSize(maxPoolSize);
        config.setMinimumIdle(Math.min(minIdle, maxPoolSize));
        config.setConnectionTimeout(connectionTimeoutMs);
        config.setIdleTimeout(600000);  // 10 minutes idle timeout
        config.setMaxLifetime(1800000);  // 30 minutes max lifetime
        config.setReadOnly(readOnly);

        config.addDataSourceProperty("ApplicationName", applicationName);
        config.addDataSourceProperty("defaultRowFetchSize", String.valueOf(JdbcSqlExecutor.FETCH_SIZE));

        return config;
    }

    private DataSource createPooledDataSource(ConnectionUrl url, String poolName, boolean readOnly) {
        HikariConfig config = buildHikariConfig(url, poolName, readOnly);
        HikariDataSource dataSource = new HikariDataSource(config);

        log.info("📊 Pool '{}': max={}, min={}, readOnly={}",
                poolName, config.getMaximumPoolSize(), config.getMinimumIdle(), readOnly);

        return dataSource;
    }

    private DataSource createDriverDataSource(ConnectionUrl url) {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(url.jdbcUrl(), url.username(), url.password());
        Properties properties = new Properties();
        properties.setProperty("ApplicationName", applicationName);
        dataSource.setConnectionProperties(properties);
        return dataSource;
    }

    private JdbcTemplate createJdbcTemplate(DataSource dataSource) {
        JdbcTemplate template = new JdbcTemplate(dataSource);
        template.setFetchSize(JdbcSqlExecutor.FETCH_SIZE);
        return template;
    }

    private ConnectionUrl parse(String connectionString, String source) {
        try {
            return ConnectionUrl.parse(connectionString);
        } catch (IllegalArgumentException e) {
            throw new DatabaseConfigurationException(
                    source + " is not a valid PostgreSQL connection string: " + e.getMessage(), e);
        }
    }
}
