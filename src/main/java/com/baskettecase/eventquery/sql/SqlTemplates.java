package com.baskettecase.eventquery.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Placeholder substitution for SQL templates.
 *
 * Templates reference values as {@code {{name}}} or {@code {{name::type}}}. Every occurrence
 * becomes its own positional parameter, so a name used twice binds twice. This is the only
 * place where caller values enter a statement, and they only ever enter as bind parameters.
 */
public final class SqlTemplates {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*(\\w+)(::\\w+)?\\s*}}");

    private SqlTemplates() {
    }

    /**
     * Rewrite a template into a positionally parameterized statement.
     *
     * @param template SQL text with named placeholders
     * @param data values by placeholder name; a missing name binds {@code null}
     * @return statement text and parameters in occurrence order
     */
    public static ParameterizedQuery parameterize(String template, Map<String, ?> data) {
        if (template == null) {
            return new ParameterizedQuery(null, null, List.of());
        }

        List<Object> params = new ArrayList<>();
        StringBuilder sql = new StringBuilder(template.length());
        StringBuilder jdbcSql = new StringBuilder(template.length());

        Matcher matcher = PLACEHOLDER.matcher(template);
        int last = 0;
        while (matcher.find()) {
            String name = matcher.group(1);
            String type = matcher.group(2) != null ? matcher.group(2) : "";

            params.add(data != null ? data.get(name) : null);

            String between = template.substring(last, matcher.start());
            sql.append(between).append('$').append(params.size()).append(type);
            jdbcSql.append(between).append('?').append(type);
            last = matcher.end();
        }
        sql.append(template, last, template.length());
        jdbcSql.append(template, last, template.length());

        return new ParameterizedQuery(sql.toString(), jdbcSql.toString(), params);
    }
}
