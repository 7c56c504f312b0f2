package org.iceforge.saga.analytics.service;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Service;

import java.sql.PreparedStatement;
import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs read queries against the warehouse. Each call borrows one pooled connection for the
 * duration of the statement only.
 */
@Service
public class WarehouseQueryExecutor {

    private final JdbcTemplate jdbcTemplate;

    public WarehouseQueryExecutor(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate);
    }

    public QueryResult query(String sql) {
        return jdbcTemplate.query(sql, EXTRACTOR);
    }

    /**
     * Query with a row cap and statement timeout, for generated SQL.
     */
    public QueryResult query(String sql, int maxRows, int timeoutSeconds) {
        return jdbcTemplate.query(con -> {
            PreparedStatement ps = con.prepareStatement(sql);
            ps.setMaxRows(maxRows);
            ps.setQueryTimeout(timeoutSeconds);
            ps.setFetchSize(Math.min(maxRows, 200));
            return ps;
        }, EXTRACTOR);
    }

    public List<String> distinctValues(String table, String quotedColumn) {
        return jdbcTemplate.queryForList(
                "SELECT DISTINCT " + quotedColumn + " FROM " + table + " ORDER BY " + quotedColumn, String.class);
    }

    public void ping() {
        jdbcTemplate.queryForObject("SELECT 1", Integer.class);
    }

    private static final ResultSetExtractor<QueryResult> EXTRACTOR = rs -> {
        ResultSetMetaData md = rs.getMetaData();
        int cols = md.getColumnCount();
        List<String> columns = new ArrayList<>(cols);
        for (int i = 1; i <= cols; i++) columns.add(md.getColumnLabel(i));

        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= cols; i++) {
                row.put(columns.get(i - 1), rs.getObject(i));
            }
            rows.add(row);
        }
        return new QueryResult(columns, rows);
    };

    public record QueryResult(List<String> columns, List<Map<String, Object>> rows) {

        public boolean isEmpty() {
            return rows.isEmpty();
        }

        public Map<String, Object> firstRow() {
            return rows.isEmpty() ? Map.of() : rows.get(0);
        }
    }
}
