package com.baskettecase.eventquery.query;

import java.util.List;
import java.util.Map;

/**
 * Model-level find/count operations of the data access layer.
 *
 * Criteria use the ORM's map form: {@code where}, {@code take}, {@code skip},
 * {@code orderBy} (a list of single-key maps, field to {@code asc}/{@code desc}) and
 * whatever selection keys the model supports.
 */
public interface ModelRepository<T> {

    List<T> findMany(Map<String, Object> criteria);

    long count(Map<String, Object> criteria);
}
