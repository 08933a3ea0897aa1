package com.baskettecase.eventquery.sql;

import java.util.regex.Pattern;

/**
 * Checks for identifiers that have to be written into SQL text because they cannot be bound.
 */
public final class SqlIdentifiers {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-zA-Z_][a-zA-Z0-9_]*(\\.[a-zA-Z_][a-zA-Z0-9_]*)?");

    private SqlIdentifiers() {
    }

    /**
     * @return the identifier, unchanged
     * @throws IllegalArgumentException if it is not a plain (optionally qualified) name
     */
    public static String requireIdentifier(String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid column name: " + identifier);
        }
        return identifier;
    }

    /**
     * Double-quote an identifier, doubling embedded quotes.
     */
    public static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
