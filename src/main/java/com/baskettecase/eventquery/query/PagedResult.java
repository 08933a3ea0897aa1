package com.baskettecase.eventquery.query;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One page of results plus the total row count.
 *
 * A {@code pageSize} of zero or less means the page holds every row.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PagedResult<T>(
        List<T> data,
        long count,
        int page,
        int pageSize,
        String orderBy,
        String search
) {
}
