package com.baskettecase.eventquery.sql;

import java.util.Collections;
import java.util.List;

/**
 * A SQL statement with its positional bind values.
 *
 * {@code sql} carries PostgreSQL style markers ({@code $1}, {@code $2::uuid}, ...),
 * {@code jdbcSql} the same statement with JDBC {@code ?} markers. Both have exactly
 * one marker per entry in {@code params}, in the same order.
 */
public record ParameterizedQuery(String sql, String jdbcSql, List<Object> params) {

    public ParameterizedQuery {
        params = Collections.unmodifiableList(params);
    }

    public Object[] paramArray() {
        return params.toArray();
    }
}
