package com.baskettecase.eventquery.db;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.env.MockEnvironment;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ConnectionStringResolver
 */
@ExtendWith(MockitoExtension.class)
class ConnectionStringResolverTest {

    private static final String STATIC_URL = "postgresql://app:pw@db:5432/events";

    @Mock
    private RequestCredentialProvider requestCredentials;

    private MockEnvironment environment;
    private ConnectionStringResolver resolver;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment();
        resolver = new ConnectionStringResolver(requestCredentials, environment);
    }

    @Test
    void testStaticConnectionStringIsCached() {
        environment.setProperty("DATABASE_URL", STATIC_URL);
        when(requestCredentials.currentConnectionString()).thenReturn(Optional.empty());

        ConnectionStringResolver.ResolvedConnection first = resolver.resolve();
        environment.setProperty("DATABASE_URL", "postgresql://other:pw@db:5432/events");
        ConnectionStringResolver.ResolvedConnection second = resolver.resolve();

        assertFalse(first.requestScoped());
        assertEquals(STATIC_URL, first.connectionString());
        assertEquals(STATIC_URL, second.connectionString());
    }

    @Test
    void testRequestScopedConnectionStringWins() {
        environment.setProperty("DATABASE_URL", STATIC_URL);
        when(requestCredentials.currentConnectionString())
                .thenReturn(Optional.of("postgresql://tenant1:pw@db:5432/events"))
                .thenReturn(Optional.of("postgresql://tenant2:pw@db:5432/events"));

        ConnectionStringResolver.ResolvedConnection first = resolver.resolve();
        ConnectionStringResolver.ResolvedConnection second = resolver.resolve();

        assertTrue(first.requestScoped());
        assertTrue(second.requestScoped());
        assertEquals("postgresql://tenant1:pw@db:5432/events", first.connectionString());
        assertEquals("postgresql://tenant2:pw@db:5432/events", second.connectionString());
    }

    @Test
    void testRequestScopedValueDoesNotReachStaticCache() {
        environment.setProperty("DATABASE_URL", STATIC_URL);
        when(requestCredentials.currentConnectionString())
                .thenReturn(Optional.of("postgresql://tenant1:pw@db:5432/events"))
                .thenReturn(Optional.empty());

        resolver.resolve();
        ConnectionStringResolver.ResolvedConnection fallback = resolver.resolve();

        assertFalse(fallback.requestScoped());
        assertEquals(STATIC_URL, fallback.connectionString());
    }

    @Test
    void testMissingConfigurationThrows() {
        when(requestCredentials.currentConnectionString()).thenReturn(Optional.empty());

        assertThrows(DatabaseConfigurationException.class, () -> resolver.resolve());
    }

    @Test
    void testBlankConfigurationThrows() {
        environment.setProperty("DATABASE_URL", "  ");
        when(requestCredentials.currentConnectionString()).thenReturn(Optional.of(" "));

        assertThrows(DatabaseConfigurationException.class, () -> resolver.getConnectionString());
    }

    @Test
    void testProviderFailureFallsBackToStatic() {
        environment.setProperty("DATABASE_URL", STATIC_URL);
        when(requestCredentials.currentConnectionString()).thenThrow(new IllegalStateException("no request"));

        assertEquals(STATIC_URL, resolver.getConnectionString());
    }

    @Test
    void testReplicaConnectionString() {
        assertEquals(Optional.empty(), resolver.getReplicaConnectionString());

        environment.setProperty("DATABASE_REPLICA_URL", "postgresql://ro:pw@replica:5432/events");

        assertEquals(Optional.of("postgresql://ro:pw@replica:5432/events"), resolver.getReplicaConnectionString());
    }

    @Test
    void testResolvedConnectionToStringIsSanitized() {
        String text = new ConnectionStringResolver.ResolvedConnection(STATIC_URL, false).toString();

        assertFalse(text.contains(":pw@"));
    }
}
