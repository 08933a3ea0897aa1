package com.baskettecase.eventquery.filter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates filter maps into SQL predicate fragments and bind values.
 *
 * Fragments only ever reference values through {@code {{name}}} placeholders; the values
 * themselves come from {@link #queryParams(Map)} and are bound by
 * {@link com.baskettecase.eventquery.sql.SqlTemplates}.
 *
 * Filters whose name maps to no column, or whose operator is unknown, add nothing.
 * Validation of filter names belongs to the request boundary, not here.
 */
public final class FilterQueries {

    static final String REFERRER_SELF_EXCLUSION =
            "and (website_event.referrer_domain != website_event.hostname or website_event.referrer_domain is null)";

    static final String JOIN_SESSION =
            "inner join session on website_event.session_id = session.session_id and website_event.website_id = session.website_id";

    private FilterQueries() {
    }

    /**
     * Resolve each non-null filter against the column map, in map iteration order.
     */
    public static List<FilterDescriptor> descriptors(Map<String, ?> filters, QueryOptions options) {
        List<FilterDescriptor> descriptors = new ArrayList<>();
        if (filters == null) {
            return descriptors;
        }

        QueryOptions opts = options != null ? options : QueryOptions.defaults();
        filters.forEach((name, raw) -> {
            if (raw == null) {
                return;
            }
            FilterValue value = FilterValue.parse(raw);
            String prefix = value.prefix().isEmpty() ? opts.resolvedColumnPrefix() : value.prefix();
            descriptors.add(new FilterDescriptor(name, FilterColumns.columnFor(name), value.operator(), value.value(), prefix));
        });
        return descriptors;
    }

    public static String filterQuery(Map<String, ?> filters) {
        return filterQuery(filters, QueryOptions.defaults());
    }

    /**
     * Build the {@code and ...} predicate lines for a filter map.
     *
     * In cohort mode only {@code cohort_} keys count, each resolved by its unprefixed name,
     * while the placeholder keeps the full key so cohort and primary values never collide.
     */
    public static String filterQuery(Map<String, ?> filters, QueryOptions options) {
        QueryOptions opts = options != null ? options : QueryOptions.defaults();
        List<String> clauses = new ArrayList<>();

        for (FilterDescriptor descriptor : descriptors(filters, opts)) {
            FilterDescriptor filter = opts.isCohort()
                    ? descriptor.withColumn(cohortColumn(descriptor.name()))
                    : descriptor;

            if (!filter.hasColumn()) {
                continue;
            }

            mapFilter(filter.prefix() + filter.column(), filter.operator(), filter.name(), null)
                    .ifPresent(predicate -> clauses.add("and " + predicate));

            // self-referrals stay excluded even when the operator is not recognised
            if (FilterColumns.REFERRER.equals(filter.name())) {
                clauses.add(REFERRER_SELF_EXCLUSION);
            }
        }

        return String.join("\n", clauses);
    }

    /**
     * Predicate for a single column, or empty for an unknown operator.
     */
    public static Optional<String> mapFilter(String column, String operator, String name, String type) {
        String placeholder = "{{" + name + (type != null && !type.isEmpty() ? "::" + type : "") + "}}";

        return Operator.fromName(operator).map(op -> op.predicate(column, placeholder));
    }

    /**
     * Bind values for a filter map: every key is kept, encoded operators are stripped and
     * substring operators get {@code %} wildcards.
     */
    public static Map<String, Object> queryParams(Map<String, ?> filters) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (filters == null) {
            return params;
        }

        params.putAll(filters);
        for (FilterDescriptor descriptor : descriptors(filters, QueryOptions.defaults())) {
            Object value = descriptor.value();
            boolean pattern = descriptor.resolvedOperator().map(Operator::isPattern).orElse(false);

            params.put(descriptor.name(), pattern && value != null ? "%" + value + "%" : value);
        }
        return params;
    }

    public static String dateQuery(Map<String, ?> filters) {
        if (filters == null || filters.get("startDate") == null) {
            return "";
        }

        if (filters.get("endDate") != null) {
            return "and website_event.created_at between {{startDate}} and {{endDate}}";
        }

        return "and website_event.created_at >= {{startDate}}";
    }

    /**
     * Everything a report query needs from one filter map.
     */
    public static ParsedFilters parseFilters(Map<String, ?> filters, QueryOptions options) {
        QueryOptions opts = options != null ? options : QueryOptions.defaults();
        Map<String, ?> source = filters != null ? filters : Map.of();

        boolean joinSession = opts.isJoinSession() || source.keySet().stream()
                .anyMatch(key -> FilterColumns.REFERRER.equals(key) || FilterColumns.SESSION_COLUMNS.contains(key));

        return new ParsedFilters(
                joinSession ? JOIN_SESSION : "",
                dateQuery(source),
                filterQuery(source, opts),
                queryParams(source),
                CohortQueryBuilder.buildCohort(source));
    }

    private static String cohortColumn(String name) {
        return FilterColumns.isCohortKey(name)
                ? FilterColumns.columnFor(FilterColumns.stripCohortPrefix(name))
                : null;
    }
}
