package com.baskettecase.eventquery.filter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the join that restricts events to sessions of a cohort.
 *
 * The cohort has its own date range ({@code cohort_startDate}, {@code cohort_endDate}) and its
 * own {@code cohort_} filters, translated in cohort mode against the same column map as
 * the primary filters.
 */
public final class CohortQueryBuilder {

    private CohortQueryBuilder() {
    }

    /**
     * @param filters full or cohort-only filter map
     * @return the cohort join, or an empty string when no {@code cohort_} key is present
     */
    public static String buildCohort(Map<String, ?> filters) {
        Map<String, Object> cohortFilters = cohortFilters(filters);
        if (cohortFilters.isEmpty()) {
            return "";
        }

        String filterQuery = FilterQueries.filterQuery(cohortFilters, QueryOptions.builder().cohort(true).build());

        return String.format("""
                join
                  (select distinct website_event.session_id
                  from website_event
                  join session on session.session_id = website_event.session_id
                    and session.website_id = website_event.website_id
                  where website_event.website_id = {{websiteId}}
                    and website_event.created_at between {{cohort_startDate}} and {{cohort_endDate}}
                    %s
                  ) cohort
                  on cohort.session_id = website_event.session_id
                """, filterQuery);
    }

    public static Map<String, Object> cohortFilters(Map<String, ?> filters) {
        Map<String, Object> cohort = new LinkedHashMap<>();
        if (filters != null) {
            filters.forEach((key, value) -> {
                if (FilterColumns.isCohortKey(key)) {
                    cohort.put(key, value);
                }
            });
        }
        return cohort;
    }
}
