package com.baskettecase.eventquery.filter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A filter value together with its operator.
 *
 * Plain strings may encode the operator as a prefix ({@code neq.chrome},
 * {@code c.google}); anything else compares with {@code equals}. The operator is kept
 * as a name so that values built with an unrecognised operator survive to translation,
 * where they produce no predicate.
 *
 * @param operator operator name, e.g. {@code contains}
 * @param value bound value
 * @param prefix optional qualifier placed before the column, e.g. {@code session.}
 */
public record FilterValue(String operator, Object value, String prefix) {

    private static final Pattern ENCODED = Pattern.compile("^(eq|neq|c|dnc)\\.(.*)$", Pattern.DOTALL);

    public FilterValue {
        prefix = prefix != null ? prefix : "";
    }

    public static FilterValue of(Operator operator, Object value) {
        return new FilterValue(operator.operatorName(), value, "");
    }

    public static FilterValue of(String operator, Object value) {
        return new FilterValue(operator, value, "");
    }

    public static FilterValue equalTo(Object value) {
        return of(Operator.EQUALS, value);
    }

    /**
     * Read a raw filter map value into an operator and value.
     */
    public static FilterValue parse(Object raw) {
        if (raw instanceof FilterValue) {
            return (FilterValue) raw;
        }

        if (raw instanceof String) {
            Matcher matcher = ENCODED.matcher((String) raw);
            if (matcher.matches()) {
                Operator operator = Operator.fromValuePrefix(matcher.group(1)).orElse(Operator.EQUALS);
                return of(operator, matcher.group(2));
            }
        }

        return equalTo(raw);
    }
}
