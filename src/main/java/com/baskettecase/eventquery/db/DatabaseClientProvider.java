package com.baskettecase.eventquery.db;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.util.Optional;

/**
 * Database Client Provider
 *
 * Hands out the {@link DatabaseClient} for the current call.
 * With a static connection string one client is built lazily and shared by every caller.
 * With a request-scoped connection string a fresh client is built on each call and never
 * cached, since it is bound to that request's credential.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatabaseClientProvider {

    private final ConnectionStringResolver resolver;
    private final DatabaseClientFactory clientFactory;
    private final ConnectionState state = new ConnectionState();

    /**
     * Get the client for the current call. Inside {@link DatabaseClient#transaction} this is the
     * client running the transaction. Otherwise the static/request-scoped decision is made
     * again on every call.
     *
     * @throws DatabaseConfigurationException if no connection string is available
     */
    public DatabaseClient getClient() {
        Optional<DatabaseClient> transactionClient = DatabaseClient.currentTransactionClient();
        if (transactionClient.isPresent()) {
            return transactionClient.get();
        }

        ConnectionStringResolver.ResolvedConnection connection = resolver.resolve();
        String replicaUrl = resolver.getReplicaConnectionString().orElse(null);

        if (connection.requestScoped()) {
            log.debug("Building request-scoped database client");
            return state.dynamicClient(() -> clientFactory.create(connection.connectionString(), replicaUrl, true));
        }

        return state.staticClient(() -> clientFactory.create(connection.connectionString(), replicaUrl, false));
    }

    public ConnectionState.Mode getMode() {
        return state.mode();
    }

    /**
     * Close the shared pools on shutdown
     */
    @PreDestroy
    public void cleanup() {
        state.clear().ifPresent(client -> {
            log.info("🔌 Shutting down shared database client");
            client.close();
        });
    }
}
