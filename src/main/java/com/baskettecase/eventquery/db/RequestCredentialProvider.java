package com.baskettecase.eventquery.db;

import java.util.Optional;

/**
 * Source of a connection string that is valid only for the current request.
 *
 * Hosting platforms that broker database access per request (connection proxies,
 * short-lived credentials) supply one; everywhere else this is empty and the static
 * configuration applies.
 */
public interface RequestCredentialProvider {

    Optional<String> currentConnectionString();
}
