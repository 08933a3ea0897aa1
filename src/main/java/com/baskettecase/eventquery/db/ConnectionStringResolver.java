package com.baskettecase.eventquery.db;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Connection String Resolver
 *
 * Decides which connection string the current call uses:
 * 1. a request-scoped connection string, when the hosting layer supplies one (never cached),
 * 2. otherwise {@code DATABASE_URL}, read once and kept for the life of the process.
 *
 * Request-scoped values are tracked only to log each change once; they never feed the
 * static cache, so one request's credentials cannot reach another request.
 */
@Slf4j
@Component
public class ConnectionStringResolver {

    static final String DATABASE_URL = "DATABASE_URL";
    static final String DATABASE_REPLICA_URL = "DATABASE_REPLICA_URL";

    private final RequestCredentialProvider requestCredentials;
    private final Environment environment;

    private final AtomicReference<String> staticConnectionString = new AtomicReference<>();
    private final AtomicReference<String> lastRequestConnectionString = new AtomicReference<>();

    public ConnectionStringResolver(RequestCredentialProvider requestCredentials, Environment environment) {
        this.requestCredentials = requestCredentials;
        this.environment = environment;
    }

    /**
     * Resolve the connection string for this call.
     *
     * @throws DatabaseConfigurationException if neither source yields a value
     */
    public ResolvedConnection resolve() {
        Optional<String> requestScoped = requestScopedConnectionString();
        if (requestScoped.isPresent()) {
            String url = requestScoped.get();
            String previous = lastRequestConnectionString.getAndSet(url);
            if (!url.equals(previous)) {
                log.info("🔗 Database URL resolved from request context: {}", ConnectionUrl.sanitize(url));
            }
            return new ResolvedConnection(url, true);
        }

        String cached = staticConnectionString.get();
        if (cached != null) {
            return new ResolvedConnection(cached, false);
        }

        String configured = normalize(environment.getProperty(DATABASE_URL)).orElseThrow(() ->
                new DatabaseConfigurationException(
                        DATABASE_URL + " is not defined and no request-scoped connection string is available."));

        if (staticConnectionString.compareAndSet(null, configured)) {
            log.info("🔗 Database URL resolved from {}: {}", DATABASE_URL, ConnectionUrl.sanitize(configured));
        }
        return new ResolvedConnection(staticConnectionString.get(), false);
    }

    public String getConnectionString() {
        return resolve().connectionString();
    }

    public Optional<String> getReplicaConnectionString() {
        return normalize(environment.getProperty(DATABASE_REPLICA_URL));
    }

    private Optional<String> requestScopedConnectionString() {
        try {
            return requestCredentials.currentConnectionString().flatMap(ConnectionStringResolver::normalize);
        } catch (RuntimeException e) {
            log.debug("Request-scoped connection string unavailable: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<String> normalize(String value) {
        return RequestAttributeCredentialProvider.normalize(value);
    }

    /**
     * @param connectionString the connection string to use
     * @param requestScoped true when it came from the request and must not be cached
     */
    public record ResolvedConnection(String connectionString, boolean requestScoped) {

        @Override
        public String toString() {
            return "ResolvedConnection[" + ConnectionUrl.sanitize(connectionString) + ", requestScoped=" + requestScoped + "]";
        }
    }
}
