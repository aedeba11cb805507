package com.enterprise.sqlbind.shared.statementbridge.adapter;

import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.JdbcUtils;

import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Stock row shapes for the fetch helpers.
 */
public final class RowMappers {

    private RowMappers() {}

    /** Column label to value, case-insensitive keys. */
    public static RowMapper<Map<String, Object>> columnMap() {
        return new ColumnMapRowMapper();
    }

    /** Column values in select-list order. */
    public static RowMapper<List<Object>> columnList() {
        return (rs, rowNum) -> {
            ResultSetMetaData meta = rs.getMetaData();
            int count = meta.getColumnCount();
            List<Object> row = new ArrayList<>(count);
            for (int i = 1; i <= count; i++) {
                row.add(JdbcUtils.getResultSetValue(rs, i));
            }
            return row;
        };
    }

    /** A single column by 1-based index. */
    public static RowMapper<Object> column(int columnIndex) {
        return (rs, rowNum) -> JdbcUtils.getResultSetValue(rs, columnIndex);
    }

    /** A single column by 1-based index, converted to {@code type}. */
    public static <T> RowMapper<T> column(int columnIndex, Class<T> type) {
        return (rs, rowNum) -> type.cast(JdbcUtils.getResultSetValue(rs, columnIndex, type));
    }
}
