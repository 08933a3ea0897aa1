package com.baskettecase.eventquery.filter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Filter names and the event/session columns they constrain.
 */
public final class FilterColumns {

    public static final String COHORT_PREFIX = "cohort_";
    public static final String REFERRER = "referrer";

    public static final Map<String, String> FILTER_COLUMNS;

    /** Filters that live on the session table and require the session join. */
    public static final Set<String> SESSION_COLUMNS = Set.of(
            "browser", "os", "device", "screen", "language",
            "country", "region", "city", "hostname", "distinctId");

    static {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("path", "url_path");
        columns.put("entry", "url_path");
        columns.put("exit", "url_path");
        columns.put("referrer", "referrer_domain");
        columns.put("domain", "referrer_domain");
        columns.put("title", "page_title");
        columns.put("query", "url_query");
        columns.put("os", "os");
        columns.put("browser", "browser");
        columns.put("device", "device");
        columns.put("screen", "screen");
        columns.put("language", "language");
        columns.put("country", "country");
        columns.put("region", "region");
        columns.put("city", "city");
        columns.put("hostname", "hostname");
        columns.put("event", "event_name");
        columns.put("tag", "tag");
        columns.put("distinctId", "distinct_id");
        columns.put("utmSource", "utm_source");
        columns.put("utmMedium", "utm_medium");
        columns.put("utmCampaign", "utm_campaign");
        columns.put("utmContent", "utm_content");
        columns.put("utmTerm", "utm_term");
        FILTER_COLUMNS = Map.copyOf(columns);
    }

    private FilterColumns() {
    }

    public static String columnFor(String name) {
        return name != null ? FILTER_COLUMNS.get(name) : null;
    }

    public static boolean isCohortKey(String name) {
        return name != null && name.startsWith(COHORT_PREFIX);
    }

    public static String stripCohortPrefix(String name) {
        return isCohortKey(name) ? name.substring(COHORT_PREFIX.length()) : name;
    }
}
