package com.baskettecase.eventquery.filter;

import java.util.Map;

/**
 * SQL fragments and bind values derived from one filter map, ready to be dropped into a
 * report template. Empty fragments are empty strings, never {@code null}.
 */
public record ParsedFilters(
        String joinSessionQuery,
        String dateQuery,
        String filterQuery,
        Map<String, Object> queryParams,
        String cohortQuery
) {
}
