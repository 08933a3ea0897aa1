package com.baskettecase.eventquery.filter;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FilterQueries
 */
class FilterQueriesTest {

    @Test
    void testOperatorShapes() {
        assertEquals("and browser = {{browser}}", FilterQueries.filterQuery(Map.of("browser", "chrome")));
        assertEquals("and browser != {{browser}}", FilterQueries.filterQuery(Map.of("browser", "neq.chrome")));
        assertEquals("and url_path ilike {{path}}", FilterQueries.filterQuery(Map.of("path", "c.blog")));
        assertEquals("and url_path not ilike {{path}}", FilterQueries.filterQuery(Map.of("path", "dnc.blog")));
    }

    @Test
    void testStructuredOperators() {
        for (Operator operator : Operator.values()) {
            String sql = FilterQueries.filterQuery(Map.of("os", FilterValue.of(operator, "Linux")));

            assertEquals("and os " + operator.sql() + " {{os}}", sql);
        }
    }

    @Test
    void testUnknownOperatorProducesNothing() {
        assertEquals("", FilterQueries.filterQuery(Map.of("browser", FilterValue.of("startsWith", "chr"))));
        assertEquals(Optional.empty(), FilterQueries.mapFilter("browser", "startsWith", "browser", null));
    }

    @Test
    void testUnknownColumnIsSkipped() {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("nonsense", "x");
        filters.put("country", "US");

        assertEquals("and country = {{country}}", FilterQueries.filterQuery(filters));
    }

    @Test
    void testReferrerAddsSelfExclusion() {
        String sql = FilterQueries.filterQuery(Map.of("referrer", "google.com"));

        assertEquals("and referrer_domain = {{referrer}}\n" + FilterQueries.REFERRER_SELF_EXCLUSION, sql);
    }

    @Test
    void testReferrerWithUnknownOperatorKeepsSelfExclusion() {
        String sql = FilterQueries.filterQuery(Map.of("referrer", FilterValue.of("startsWith", "google")));

        assertEquals(FilterQueries.REFERRER_SELF_EXCLUSION, sql);
    }

    @Test
    void testDomainDoesNotAddSelfExclusion() {
        assertEquals("and referrer_domain = {{domain}}", FilterQueries.filterQuery(Map.of("domain", "google.com")));
    }

    @Test
    void testFragmentsFollowIterationOrder() {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("country", "US");
        filters.put("path", "/pricing");
        filters.put("event", "signup");

        assertEquals("and country = {{country}}\nand url_path = {{path}}\nand event_name = {{event}}",
                FilterQueries.filterQuery(filters));
    }

    @Test
    void testColumnPrefix() {
        QueryOptions options = QueryOptions.builder().columnPrefix("session.").build();

        assertEquals("and session.country = {{country}}", FilterQueries.filterQuery(Map.of("country", "US"), options));
        assertEquals("and website_event.country = {{country}}",
                FilterQueries.filterQuery(Map.of("country", new FilterValue("equals", "US", "website_event.")), options));
    }

    @Test
    void testMapFilterWithType() {
        assertEquals(Optional.of("session_id = {{sessionId::uuid}}"),
                FilterQueries.mapFilter("session_id", "equals", "sessionId", "uuid"));
    }

    @Test
    void testQueryParamsWrapsPatternOperators() {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("websiteId", "a1b2");
        filters.put("path", "c.blog");
        filters.put("title", FilterValue.of(Operator.DOES_NOT_CONTAIN, "draft"));
        filters.put("browser", "neq.chrome");

        Map<String, Object> params = FilterQueries.queryParams(filters);

        assertEquals("a1b2", params.get("websiteId"));
        assertEquals("%blog%", params.get("path"));
        assertEquals("%draft%", params.get("title"));
        assertEquals("chrome", params.get("browser"));
    }

    @Test
    void testDateQuery() {
        assertEquals("and website_event.created_at between {{startDate}} and {{endDate}}",
                FilterQueries.dateQuery(Map.of("startDate", "2024-01-01", "endDate", "2024-01-31")));
        assertEquals("and website_event.created_at >= {{startDate}}",
                FilterQueries.dateQuery(Map.of("startDate", "2024-01-01")));
        assertEquals("", FilterQueries.dateQuery(Map.of()));
    }

    @Test
    void testParseFiltersJoinsSessionForSessionColumns() {
        assertEquals(FilterQueries.JOIN_SESSION,
                FilterQueries.parseFilters(Map.of("country", "US"), null).joinSessionQuery());
        assertEquals(FilterQueries.JOIN_SESSION,
                FilterQueries.parseFilters(Map.of("referrer", "google.com"), null).joinSessionQuery());
        assertEquals("", FilterQueries.parseFilters(Map.of("path", "/"), null).joinSessionQuery());
        assertEquals(FilterQueries.JOIN_SESSION,
                FilterQueries.parseFilters(Map.of("path", "/"), QueryOptions.builder().joinSession(true).build()).joinSessionQuery());
    }

    @Test
    void testEndToEndWithCohort() {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("browser", "chrome");
        filters.put("cohort_browser", "safari");
        filters.put("startDate", "2024-01-01");
        filters.put("endDate", "2024-01-31");

        ParsedFilters parsed = FilterQueries.parseFilters(filters, QueryOptions.defaults());

        assertEquals("and browser = {{browser}}", parsed.filterQuery());
        assertEquals("and website_event.created_at between {{startDate}} and {{endDate}}", parsed.dateQuery());
        assertTrue(parsed.cohortQuery().contains("and browser = {{cohort_browser}}"));
        assertTrue(parsed.cohortQuery().contains("on cohort.session_id = website_event.session_id"));
        assertFalse(parsed.filterQuery().contains("cohort_browser"));
        assertEquals("chrome", parsed.queryParams().get("browser"));
        assertEquals("safari", parsed.queryParams().get("cohort_browser"));
    }

    @Test
    void testDescriptorsSkipNullValues() {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("browser", null);
        filters.put("os", "eq.Linux");

        List<FilterDescriptor> descriptors = FilterQueries.descriptors(filters, null);

        assertEquals(1, descriptors.size());
        assertEquals(new FilterDescriptor("os", "os", "equals", "Linux", ""), descriptors.get(0));
    }
}
