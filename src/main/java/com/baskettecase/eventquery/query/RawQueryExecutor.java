package com.baskettecase.eventquery.query;

import com.baskettecase.eventquery.db.DatabaseClient;
import com.baskettecase.eventquery.db.DatabaseClientProvider;
import com.baskettecase.eventquery.db.SqlExecutor;
import com.baskettecase.eventquery.sql.ParameterizedQuery;
import com.baskettecase.eventquery.sql.ReadOnlyStatementDetector;
import com.baskettecase.eventquery.sql.SqlIdentifiers;
import com.baskettecase.eventquery.sql.SqlTemplates;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import jakarta.annotation.PostConstruct;
import java.util.List;
import java.util.Map;

/**
 * Raw Query Executor
 *
 * Runs SQL templates with {@code {{name}}} placeholders against the current database client.
 * Read-only queries go to the replica when one is configured, unless a transaction is
 * active on the calling thread. When the connection string
 * names a schema, {@code SET search_path} runs first on the same connection.
 *
 * Database errors propagate unchanged; nothing is retried here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RawQueryExecutor {

    private final DatabaseClientProvider clientProvider;
    private final ReadOnlyStatementDetector readOnlyDetector;
    private final MeterRegistry meterRegistry;

    @Value("${LOG_QUERY:}")
    private String logQuery;

    private Counter queryCounter;
    private Timer queryTimer;

    @PostConstruct
    public void initializeMetrics() {
        queryCounter = Counter.builder("eventquery.raw_query.executions")
                .description("Total number of raw query executions")
                .register(meterRegistry);
        queryTimer = Timer.builder("eventquery.raw_query.duration")
                .description("Time taken to execute raw queries")
                .register(meterRegistry);
    }

    public List<Map<String, Object>> rawQuery(String sql, Map<String, ?> data) {
        return rawQuery(sql, data, null);
    }

    /**
     * Parameterize and run a query template.
     *
     * @param sql template with named placeholders
     * @param data placeholder values
     * @param name optional label for query logging
     * @return result rows
     */
    public List<Map<String, Object>> rawQuery(String sql, Map<String, ?> data, String name) {
        if (queryLoggingEnabled()) {
            log.info("QUERY:\n{}", sql);
            log.info("PARAMETERS:\n{}", data);
            log.info("NAME:\n{}", name);
        }

        DatabaseClient client = clientProvider.getClient();
        ParameterizedQuery query = SqlTemplates.parameterize(sql, data);
        SqlExecutor executor = selectExecutor(client, query);

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            queryCounter.increment();

            return executor.withSession(session -> {
                client.schema().ifPresent(schema -> session.executeStatement(searchPathStatement(schema)));
                return session.executeParameterized(query.jdbcSql(), query.params());
            });
        } catch (DataAccessException e) {
            log.error("❌ Query execution failed{}", name != null ? " (" + name + ")" : "", e);
            throw e;
        } finally {
            sample.stop(queryTimer);
        }
    }

    static String searchPathStatement(String schema) {
        return "SET search_path TO " + SqlIdentifiers.quoteIdentifier(schema) + ";";
    }

    /**
     * Any non-blank {@code LOG_QUERY} other than {@code false} turns query logging on.
     */
    boolean queryLoggingEnabled() {
        return logQuery != null && !logQuery.isBlank() && !"false".equalsIgnoreCase(logQuery.trim());
    }

    private SqlExecutor selectExecutor(DatabaseClient client, ParameterizedQuery query) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return client.primary();
        }
        if (client.hasReplica() && readOnlyDetector.isReadOnly(query.jdbcSql())) {
            log.debug("Routing query to replica");
            return client.replica().orElse(client.primary());
        }
        return client.primary();
    }
}
