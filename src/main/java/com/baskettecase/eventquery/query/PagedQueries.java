package com.baskettecase.eventquery.query;

import com.baskettecase.eventquery.filter.QueryOptions;
import com.baskettecase.eventquery.sql.SqlIdentifiers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Paged Queries
 *
 * Wraps a model lookup or a raw SQL template with a total count and a page window.
 * The count and the page are read separately, so rows written between the two reads
 * can make them disagree.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PagedQueries {

    private final RawQueryExecutor rawQueryExecutor;

    /**
     * Page through a model using its find/count operations.
     *
     * @param model model-level data access
     * @param criteria ORM criteria, including an optional {@code where}
     * @param options paging and ordering
     */
    public <T> PagedResult<T> pagedQuery(ModelRepository<T> model, Map<String, Object> criteria, QueryOptions options) {
        QueryOptions opts = options != null ? options : QueryOptions.defaults();
        Map<String, Object> findCriteria = new HashMap<>(criteria != null ? criteria : Map.of());

        if (opts.isPaged()) {
            findCriteria.put("take", opts.resolvedPageSize());
            findCriteria.put("skip", opts.offset());
        }
        if (opts.getOrderBy() != null) {
            findCriteria.put("orderBy", List.of(Map.of(opts.getOrderBy(), opts.direction())));
        }

        List<T> data = model.findMany(findCriteria);

        Map<String, Object> countCriteria = new HashMap<>();
        if (criteria != null && criteria.containsKey("where")) {
            countCriteria.put("where", criteria.get("where"));
        }
        long count = model.count(countCriteria);

        log.debug("📊 Paged model query returned {} of {} rows", data.size(), count);

        return new PagedResult<>(data, count, opts.resolvedPage(), opts.resolvedPageSize(),
                opts.getOrderBy(), opts.getSearch());
    }

    public PagedResult<Map<String, Object>> pagedRawQuery(String query, Map<String, ?> params, QueryOptions options) {
        return pagedRawQuery(query, params, options, null);
    }

    /**
     * Count the rows of a raw query, then fetch one page of it.
     *
     * @param query base SQL template, without order/limit clauses
     * @param params placeholder values for the template
     * @param options paging and ordering; {@code orderBy} must be a plain column name
     * @param name optional label for query logging
     * @throws IllegalArgumentException if {@code orderBy} is not a valid identifier
     */
    public PagedResult<Map<String, Object>> pagedRawQuery(String query, Map<String, ?> params,
                                                           QueryOptions options, String name) {
        QueryOptions opts = options != null ? options : QueryOptions.defaults();
        String orderBy = opts.getOrderBy() != null ? SqlIdentifiers.requireIdentifier(opts.getOrderBy()) : null;

        List<Map<String, Object>> countRows = rawQueryExecutor.rawQuery(countQuery(query), params, name);
        long count = countFrom(countRows);

        List<Map<String, Object>> data = rawQueryExecutor.rawQuery(pageQuery(query, orderBy, opts), params, name);

        log.debug("📊 Paged raw query returned {} of {} rows", data.size(), count);

        return new PagedResult<>(data, count, opts.resolvedPage(), opts.resolvedPageSize(),
                orderBy, opts.getSearch());
    }

    static String countQuery(String query) {
        return "select count(*) as num from (" + query + ") t";
    }

    static String pageQuery(String query, String orderBy, QueryOptions opts) {
        StringBuilder sql = new StringBuilder(query);
        if (orderBy != null) {
            sql.append("\norder by ").append(orderBy).append(' ').append(opts.direction());
        }
        if (opts.isPaged()) {
            sql.append("\nlimit ").append(opts.resolvedPageSize()).append(" offset ").append(opts.offset());
        }
        return sql.toString();
    }

    private static long countFrom(List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) {
            return 0L;
        }
        Object num = rows.get(0).get("num");
        return num instanceof Number ? ((Number) num).longValue() : 0L;
    }
}
