package com.baskettecase.eventquery.db;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Low-level statement execution against one database.
 */
public interface SqlExecutor {

    /**
     * Run a query with JDBC ({@code ?}) markers and return its rows.
     */
    List<Map<String, Object>> executeParameterized(String sql, List<Object> params);

    /**
     * Run a statement that returns no rows.
     */
    void executeStatement(String sql);

    /**
     * Run {@code work} with an executor pinned to a single connection, so session settings
     * made through it apply to the statements that follow.
     */
    <T> T withSession(Function<SqlExecutor, T> work);
}
