package com.enterprise.sqlbind.shared.statementbridge.adapter;

import com.enterprise.sqlbind.shared.statementbridge.port.BindableStatement;
import com.enterprise.sqlbind.sql.param.BindType;
import com.enterprise.sqlbind.sql.param.Placeholder;
import com.enterprise.sqlbind.sql.param.SqlPlaceholders;

import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.StatementCreatorUtils;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.jdbc.support.JdbcUtils;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC {@link PreparedStatement} addressed by position or by placeholder name.
 * A name that occurs several times in the SQL is bound at every occurrence.
 * Not thread-safe.
 */
class JdbcBindableStatement implements BindableStatement {

    private final JdbcStatementPreparer preparer;
    private final Connection connection;
    private final PreparedStatement statement;
    private final SqlPlaceholders.JdbcSql jdbcSql;

    private ResultSet resultSet;
    private int rowNum;
    private int updateCount;
    private boolean closed;

    JdbcBindableStatement(JdbcStatementPreparer preparer, Connection connection,
                          PreparedStatement statement, SqlPlaceholders.JdbcSql jdbcSql) {
        this.preparer = preparer;
        this.connection = connection;
        this.statement = statement;
        this.jdbcSql = jdbcSql;
    }

    @Override
    public void bindValue(Placeholder placeholder, Object value, BindType type) {
        checkOpen();
        List<Integer> positions;
        if (placeholder instanceof Placeholder.Named named) {
            positions = jdbcSql.positionsOf(named.name());
            if (positions.isEmpty()) {
                throw new InvalidDataAccessApiUsageException(
                        "Invalid parameter name: " + named.token() + " not found in SQL [" + jdbcSql.sql() + "]");
            }
        } else {
            positions = List.of(((Placeholder.Positional) placeholder).position());
        }

        // string binds send the value's text, whatever its Java type
        Object bound = type == BindType.STRING && value != null ? value.toString() : value;
        try {
            for (int position : positions) {
                StatementCreatorUtils.setParameterValue(statement, position, type.sqlType(), bound);
            }
        } catch (SQLException ex) {
            throw preparer.translate("bind " + placeholder, jdbcSql.sql(), ex);
        }
    }

    @Override
    public boolean execute() {
        checkOpen();
        closeCursor();
        try {
            if (statement.execute()) {
                resultSet = statement.getResultSet();
                updateCount = 0;
            } else {
                updateCount = Math.max(statement.getUpdateCount(), 0);
            }
            rowNum = 0;
            return true;
        } catch (SQLException ex) {
            throw preparer.translate("execute", jdbcSql.sql(), ex);
        }
    }

    @Override
    public <T> List<T> fetchAll(RowMapper<T> rowMapper) {
        checkOpen();
        List<T> rows = new ArrayList<>();
        if (resultSet == null) {
            return rows;
        }
        try {
            while (resultSet.next()) {
                rows.add(rowMapper.mapRow(resultSet, rowNum++));
            }
            return rows;
        } catch (SQLException ex) {
            throw preparer.translate("fetchAll", jdbcSql.sql(), ex);
        } finally {
            closeCursor();
        }
    }

    @Override
    public <T> T fetch(RowMapper<T> rowMapper) {
        checkOpen();
        if (resultSet == null) {
            return null;
        }
        try {
            return resultSet.next() ? rowMapper.mapRow(resultSet, rowNum++) : null;
        } catch (SQLException ex) {
            throw preparer.translate("fetch", jdbcSql.sql(), ex);
        }
    }

    @Override
    public int rowCount() {
        return updateCount;
    }

    @Override
    public void closeCursor() {
        JdbcUtils.closeResultSet(resultSet);
        resultSet = null;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        closeCursor();
        JdbcUtils.closeStatement(statement);
        DataSourceUtils.releaseConnection(connection, preparer.getDataSource());
    }

    private void checkOpen() {
        if (closed) {
            throw new InvalidDataAccessApiUsageException("Statement is closed: " + jdbcSql.sql());
        }
    }
}
