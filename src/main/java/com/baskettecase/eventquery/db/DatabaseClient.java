package com.baskettecase.eventquery.db;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Executors bound to one resolved connection string: the primary, and a read replica
 * when one is configured.
 */
@Slf4j
public class DatabaseClient implements AutoCloseable {

    private static final Object TRANSACTION_RESOURCE_KEY = DatabaseClient.class.getName() + ".transaction";

    private final SqlExecutor primary;
    private final SqlExecutor replica;
    private final DataSource primaryDataSource;
    private final List<DataSource> dataSources;
    private final String schema;
    private final boolean requestScoped;

    public DatabaseClient(SqlExecutor primary,
                          SqlExecutor replica,
                          DataSource primaryDataSource,
                          List<DataSource> dataSources,
                          String schema,
                          boolean requestScoped) {
        this.primary = primary;
        this.replica = replica;
        this.primaryDataSource = primaryDataSource;
        this.dataSources = new ArrayList<>(dataSources);
        this.schema = schema;
        this.requestScoped = requestScoped;
    }

    public SqlExecutor primary() {
        return primary;
    }

    public Optional<SqlExecutor> replica() {
        return Optional.ofNullable(replica);
    }

    public boolean hasReplica() {
        return replica != null;
    }

    /** Schema from the connection string's {@code schema} parameter, if any. */
    public Optional<String> schema() {
        return Optional.ofNullable(schema);
    }

    public boolean isRequestScoped() {
        return requestScoped;
    }

    /**
     * Run {@code action} in a transaction on the primary.
     * While it runs, this client is bound to the thread so that
     * {@link DatabaseClientProvider#getClient()} hands it back instead of resolving a new one.
     */
    public <T> T transaction(TransactionCallback<T> action) {
        if (primaryDataSource == null) {
            throw new IllegalStateException("Transactions require a primary DataSource");
        }
        TransactionTemplate template = new TransactionTemplate(new DataSourceTransactionManager(primaryDataSource));
        return template.execute(status -> {
            boolean bound = !TransactionSynchronizationManager.hasResource(TRANSACTION_RESOURCE_KEY);
            if (bound) {
                TransactionSynchronizationManager.bindResource(TRANSACTION_RESOURCE_KEY, this);
            }
            try {
                return action.doInTransaction(status);
            } finally {
                if (bound) {
                    TransactionSynchronizationManager.unbindResource(TRANSACTION_RESOURCE_KEY);
                }
            }
        });
    }

    /**
     * The client whose {@link #transaction} is running on this thread, if any.
     */
    public static Optional<DatabaseClient> currentTransactionClient() {
        return Optional.ofNullable((DatabaseClient) TransactionSynchronizationManager.getResource(TRANSACTION_RESOURCE_KEY));
    }

    /**
     * Close pooled data sources. Request-scoped clients hold none.
     */
    @Override
    public void close() {
        for (DataSource dataSource : dataSources) {
            if (dataSource instanceof Closeable) {
                try {
                    ((Closeable) dataSource).close();
                } catch (IOException e) {
                    log.warn("⚠️ Failed to close data source: {}", e.getMessage());
                }
            }
        }
    }
}
