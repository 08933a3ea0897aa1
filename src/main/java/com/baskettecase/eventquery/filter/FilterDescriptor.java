package com.baskettecase.eventquery.filter;

import java.util.Optional;

/**
 * One filter resolved against the column map.
 *
 * @param name filter key as supplied, e.g. {@code cohort_browser}
 * @param column resolved column, or {@code null} when the key maps to no column
 * @param operator operator name
 * @param value unwrapped filter value
 * @param prefix column qualifier, possibly empty
 */
public record FilterDescriptor(String name, String column, String operator, Object value, String prefix) {

    public boolean hasColumn() {
        return column != null && !column.isEmpty();
    }

    public Optional<Operator> resolvedOperator() {
        return Operator.fromName(operator);
    }

    public FilterDescriptor withColumn(String newColumn) {
        return new FilterDescriptor(name, newColumn, operator, value, prefix);
    }
}
