package com.baskettecase.eventquery.db;

import com.zaxxer.hikari.HikariConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DatabaseClientFactory
 */
class DatabaseClientFactoryTest {

    private SimpleMeterRegistry meterRegistry;
    private DatabaseClientFactory factory;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        factory = new DatabaseClientFactory(meterRegistry);
    }

    @Test
    void testHikariConfig() {
        ConnectionUrl url = ConnectionUrl.parse("postgresql://app:pw@db:5432/events?schema=tenant_a");

        HikariConfig config = factory.buildHikariConfig(url, "event-query-core-primary", false);

        assertEquals("jdbc:postgresql://db:5432/events", config.getJdbcUrl());
        assertEquals("app", config.getUsername());
        assertEquals("pw", config.getPassword());
        assertEquals("event-query-core-primary", config.getPoolName());
        assertEquals(10, config.getMaximumPoolSize());
        assertEquals(2, config.getMinimumIdle());
        assertEquals(30000, config.getConnectionTimeout());
        assertFalse(config.isReadOnly());
        assertEquals("event-query-core", config.getDataSourceProperties().getProperty("ApplicationName"));
    }

    @Test
    void testReplicaPoolIsReadOnly() {
        ConnectionUrl url = ConnectionUrl.parse("postgresql://ro:pw@replica:5432/events");

        assertTrue(factory.buildHikariConfig(url, "event-query-core-replica", true).isReadOnly());
    }

    @Test
    void testRequestScopedClient() {
        DatabaseClient client = factory.create(
                "postgresql://tenant:pw@db:5432/events?schema=tenant_a",
                "postgresql://tenant_ro:pw@replica:5432/events",
                true);

        assertTrue(client.isRequestScoped());
        assertTrue(client.hasReplica());
        assertEquals(Optional.of("tenant_a"), client.schema());
        assertEquals(1.0, meterRegistry.counter("eventquery.client.created", "mode", "dynamic").count());

        client.close();
    }

    @Test
    void testInvalidConnectionString() {
        DatabaseConfigurationException e = assertThrows(DatabaseConfigurationException.class,
                () -> factory.create("mysql://u:p@db/events", null, true));

        assertTrue(e.getMessage().startsWith("Request-scoped connection string"));
        assertEquals(0.0, meterRegistry.counter("eventquery.client.created", "mode", "dynamic").count());
    }

    @Test
    void testInvalidReplicaConnectionString() {
        assertThrows(DatabaseConfigurationException.class,
                () -> factory.create("postgresql://u:p@db/events", "nonsense", true));
    }
}
