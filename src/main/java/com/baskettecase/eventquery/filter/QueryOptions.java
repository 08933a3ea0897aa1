package com.baskettecase.eventquery.filter;

import lombok.Builder;
import lombok.Value;

/**
 * Per-call options for filter translation and pagination.
 *
 * All fields are optional. {@code page} defaults to 1 and {@code pageSize} to
 * {@link #DEFAULT_PAGE_SIZE}; a page size of zero or less turns paging off.
 */
@Value
@Builder(toBuilder = true)
public class QueryOptions {

    public static final int DEFAULT_PAGE_SIZE = 20;

    private static final QueryOptions DEFAULTS = QueryOptions.builder().build();

    Integer page;
    Integer pageSize;
    String orderBy;
    boolean sortDescending;
    String search;

    /** Force the session join even when no session filter is present. */
    boolean joinSession;

    /** Translate {@code cohort_} keys against their unprefixed columns. */
    boolean cohort;

    /** Qualifier prepended to every resolved filter column, e.g. {@code website_event.}. */
    String columnPrefix;

    public static QueryOptions defaults() {
        return DEFAULTS;
    }

    public int resolvedPage() {
        return page != null ? Math.max(page, 1) : 1;
    }

    public int resolvedPageSize() {
        return pageSize != null ? pageSize : DEFAULT_PAGE_SIZE;
    }

    public boolean isPaged() {
        return resolvedPageSize() > 0;
    }

    /** Rows to skip; a {@code long} so large page numbers cannot wrap negative. */
    public long offset() {
        return (long) resolvedPageSize() * (resolvedPage() - 1);
    }

    public String direction() {
        return sortDescending ? "desc" : "asc";
    }

    public String resolvedColumnPrefix() {
        return columnPrefix != null ? columnPrefix : "";
    }
}
