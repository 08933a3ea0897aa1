package com.baskettecase.eventquery.db;

import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * {@link SqlExecutor} backed by Spring's {@link JdbcTemplate}.
 */
public class JdbcSqlExecutor implements SqlExecutor {

    static final int FETCH_SIZE = 1000;

    private final JdbcTemplate jdbcTemplate;

    public JdbcSqlExecutor(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Map<String, Object>> executeParameterized(String sql, List<Object> params) {
        return jdbcTemplate.queryForList(sql, params.toArray());
    }

    @Override
    public void executeStatement(String sql) {
        jdbcTemplate.execute(sql);
    }

    @Override
    public <T> T withSession(Function<SqlExecutor, T> work) {
        return jdbcTemplate.execute((ConnectionCallback<T>) connection -> {
            // the callback connection is already close-suppressed; keep it that way
            JdbcTemplate session = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
            session.setFetchSize(FETCH_SIZE);
            return work.apply(new JdbcSqlExecutor(session));
        });
    }
}
