package com.baskettecase.eventquery.filter;

import java.util.Optional;

/**
 * Filter comparison operators and their PostgreSQL predicate shapes.
 */
public enum Operator {
    EQUALS("equals", "eq", "="),
    NOT_EQUALS("notEquals", "neq", "!="),
    CONTAINS("contains", "c", "ilike"),
    DOES_NOT_CONTAIN("doesNotContain", "dnc", "not ilike");

    private final String operatorName;
    private final String valuePrefix;
    private final String sql;

    Operator(String operatorName, String valuePrefix, String sql) {
        this.operatorName = operatorName;
        this.valuePrefix = valuePrefix;
        this.sql = sql;
    }

    /** Name used in filter definitions, e.g. {@code notEquals}. */
    public String operatorName() {
        return operatorName;
    }

    /** Short code used in encoded filter values, e.g. {@code neq.chrome}. */
    public String valuePrefix() {
        return valuePrefix;
    }

    public String sql() {
        return sql;
    }

    /** Whether bound values are matched as substrings and need {@code %} wildcards. */
    public boolean isPattern() {
        return this == CONTAINS || this == DOES_NOT_CONTAIN;
    }

    public String predicate(String column, String placeholder) {
        return column + " " + sql + " " + placeholder;
    }

    public static Optional<Operator> fromName(String name) {
        for (Operator operator : values()) {
            if (operator.operatorName.equals(name)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    public static Optional<Operator> fromValuePrefix(String prefix) {
        for (Operator operator : values()) {
            if (operator.valuePrefix.equals(prefix)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
