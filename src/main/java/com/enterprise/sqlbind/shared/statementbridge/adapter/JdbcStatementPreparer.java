package com.enterprise.sqlbind.shared.statementbridge.adapter;

import com.enterprise.sqlbind.shared.statementbridge.port.BindableStatement;
import com.enterprise.sqlbind.shared.statementbridge.port.StatementPreparer;
import com.enterprise.sqlbind.sql.param.SqlPlaceholders;

import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.jdbc.support.SQLErrorCodeSQLExceptionTranslator;
import org.springframework.jdbc.support.SQLExceptionTranslator;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link StatementPreparer} backed by a JDBC {@link DataSource}.
 *
 * <p>Named {@code :name} placeholders are compiled to JDBC {@code ?} markers
 * at prepare time; the returned statement keeps the marker-to-name mapping so
 * binds can still address them by name. Connections are obtained through
 * {@link DataSourceUtils}, so a surrounding Spring transaction is joined.
 */
public class JdbcStatementPreparer implements StatementPreparer {

    private final DataSource dataSource;
    private final SQLExceptionTranslator exceptionTranslator;
    private int fetchSize = 0;
    private int queryTimeout = 0;

    public JdbcStatementPreparer(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.exceptionTranslator = new SQLErrorCodeSQLExceptionTranslator(dataSource);
    }

    @Override
    public BindableStatement prepare(String sql) {
        Objects.requireNonNull(sql, "sql");
        SqlPlaceholders.JdbcSql jdbcSql = SqlPlaceholders.compile(sql);

        Connection con = DataSourceUtils.getConnection(dataSource);
        PreparedStatement ps = null;
        try {
            ps = con.prepareStatement(jdbcSql.sql());
            if (fetchSize > 0) {
                ps.setFetchSize(fetchSize);
            }
            if (queryTimeout > 0) {
                ps.setQueryTimeout(queryTimeout);
            }
            return new JdbcBindableStatement(this, con, ps, jdbcSql);
        } catch (SQLException ex) {
            JdbcUtils.closeStatement(ps);
            DataSourceUtils.releaseConnection(con, dataSource);
            throw translate("prepare", jdbcSql.sql(), ex);
        }
    }

    DataAccessException translate(String task, String sql, SQLException ex) {
        DataAccessException dae = exceptionTranslator.translate(task, sql, ex);
        return dae != null ? dae : new UncategorizedSQLException(task, sql, ex);
    }

    DataSource getDataSource() {
        return dataSource;
    }

    /** JDBC fetch size hint. Default 0 = driver default. */
    public void setFetchSize(int fetchSize) {
        this.fetchSize = fetchSize;
    }

    /** Query timeout in seconds. 0 = no timeout (default). */
    public void setQueryTimeout(int seconds) {
        this.queryTimeout = seconds;
    }
}
