package com.baskettecase.eventquery.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the case-insensitive search criteria passed to {@link ModelRepository#findMany}.
 *
 * A search filter is a single-entry map. A string value names the match operation for that
 * field ({@code {name: "contains"}}); a map value descends into a relation
 * ({@code {user: {username: "contains"}}}).
 */
public final class SearchParameters {

    public static final String CONTAINS = "contains";

    private SearchParameters() {
    }

    /**
     * @return {@code {AND: {OR: [...]}}}, or an empty map when {@code query} is blank
     */
    public static Map<String, Object> searchParameters(String query, List<Map<String, Object>> filters) {
        if (query == null || query.isBlank() || filters == null || filters.isEmpty()) {
            return Map.of();
        }

        List<Map<String, Object>> params = new ArrayList<>();
        for (Map<String, Object> filter : filters) {
            params.add(parseFilter(filter, query));
        }

        return Map.of("AND", Map.of("OR", params));
    }

    /**
     * Shorthand for {@code contains} filters on dotted field paths, e.g. {@code "user.username"}.
     */
    public static List<Map<String, Object>> containsFilters(String... fieldPaths) {
        List<Map<String, Object>> filters = new ArrayList<>();
        for (String path : fieldPaths) {
            filters.add(pathFilter(Arrays.asList(path.split("\\.")), CONTAINS));
        }
        return filters;
    }

    private static Map<String, Object> parseFilter(Map<?, ?> filter, String query) {
        if (filter.size() != 1) {
            throw new IllegalArgumentException("Search filter must have exactly one key: " + filter.keySet());
        }
        Map.Entry<?, ?> entry = filter.entrySet().iterator().next();
        String key = String.valueOf(entry.getKey());
        Object value = entry.getValue();

        Map<String, Object> parsed = new LinkedHashMap<>();
        if (value instanceof String) {
            Map<String, Object> match = new LinkedHashMap<>();
            match.put((String) value, query);
            match.put("mode", "insensitive");
            parsed.put(key, match);
        } else if (value instanceof Map) {
            parsed.put(key, parseFilter((Map<?, ?>) value, query));
        } else {
            throw new IllegalArgumentException("Unsupported search filter for " + key);
        }
        return parsed;
    }

    private static Map<String, Object> pathFilter(List<String> segments, String operation) {
        Map<String, Object> filter = new LinkedHashMap<>();
        if (segments.size() == 1) {
            filter.put(segments.get(0), operation);
        } else {
            filter.put(segments.get(0), pathFilter(segments.subList(1, segments.size()), operation));
        }
        return filter;
    }
}
