package com.baskettecase.eventquery.db;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Process-wide holder for the one shareable {@link DatabaseClient}.
 *
 * Only clients built from the static connection string are stored. The mode records what
 * the latest resolution was and is updated on every call, so a process can move between
 * request-scoped and static resolution without the cache ever holding a request-scoped client.
 */
public class ConnectionState {

    public enum Mode {
        UNRESOLVED,
        STATIC_CACHED,
        DYNAMIC_UNCACHED
    }

    private volatile Mode mode = Mode.UNRESOLVED;
    private volatile DatabaseClient cachedClient;

    public Mode mode() {
        return mode;
    }

    public Optional<DatabaseClient> cachedClient() {
        return Optional.ofNullable(cachedClient);
    }

    /**
     * Return the cached static client, creating it on first use.
     */
    public DatabaseClient staticClient(Supplier<DatabaseClient> factory) {
        mode = Mode.STATIC_CACHED;

        DatabaseClient client = cachedClient;
        if (client != null) {
            return client;
        }

        synchronized (this) {
            if (cachedClient == null) {
                cachedClient = factory.get();
            }
            return cachedClient;
        }
    }

    /**
     * Build a client for this call only. The result is never stored.
     */
    public DatabaseClient dynamicClient(Supplier<DatabaseClient> factory) {
        mode = Mode.DYNAMIC_UNCACHED;
        return factory.get();
    }

    /**
     * Drop and return the cached client, if any.
     */
    public synchronized Optional<DatabaseClient> clear() {
        DatabaseClient client = cachedClient;
        cachedClient = null;
        mode = Mode.UNRESOLVED;
        return Optional.ofNullable(client);
    }
}
