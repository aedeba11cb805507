package com.enterprise.sqlbind.sql.binder;

import com.enterprise.sqlbind.shared.statementbridge.adapter.RowMappers;
import com.enterprise.sqlbind.shared.statementbridge.port.BindableStatement;
import com.enterprise.sqlbind.shared.statementbridge.port.StatementPreparer;
import com.enterprise.sqlbind.sql.debug.QueryDebugger;
import com.enterprise.sqlbind.sql.param.BindInstruction;
import com.enterprise.sqlbind.sql.param.ParameterParser;
import com.enterprise.sqlbind.sql.param.Params;
import com.enterprise.sqlbind.sql.param.ParsedQuery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Prepares statements from SQL plus typed {@link Params} and runs them.
 *
 * <p>Error policy:
 * <ul>
 *   <li>{@link #prepareBind} propagates every failure (malformed key, bad SQL,
 *       unknown placeholder).</li>
 *   <li>{@link #execute}, {@link #fetchAll} and {@link #fetchOne} still propagate
 *       parse, prepare and bind failures, but report an execution failure as an
 *       empty result.</li>
 * </ul>
 *
 * <pre>{@code
 * SqlBinder db = new SqlBinder(new JdbcStatementPreparer(dataSource));
 * OptionalInt deleted = db.execute("DELETE FROM tbl WHERE id IN(:ids)",
 *         Params.named(":ids[i]", List.of(3, 4, 5)));
 * }</pre>
 */
public class SqlBinder {

    private static final Logger log = LoggerFactory.getLogger(SqlBinder.class);

    private final StatementPreparer statementPreparer;
    private final ParameterParser parameterParser;

    public SqlBinder(StatementPreparer statementPreparer) {
        this(statementPreparer, new ParameterParser());
    }

    public SqlBinder(StatementPreparer statementPreparer, ParameterParser parameterParser) {
        this.statementPreparer = Objects.requireNonNull(statementPreparer, "statementPreparer");
        this.parameterParser = Objects.requireNonNull(parameterParser, "parameterParser");
    }

    public StatementPreparer getStatementPreparer() {
        return statementPreparer;
    }

    /** Rewrites the query and resolves its binds without touching the database. */
    public ParsedQuery parse(String query, Params params) {
        return parameterParser.parse(query, params);
    }

    /**
     * Prepares the rewritten query and applies every bind in order.
     *
     * @return a bound statement, owned by the caller
     */
    public BindableStatement prepareBind(String query, Params params) {
        ParsedQuery parsed = parameterParser.parse(query, params);
        log.debug("Preparing [{}] with {} bind(s)", parsed.sql(), parsed.binds().size());
        if (log.isTraceEnabled()) {
            log.trace("\n{}", QueryDebugger.format(parsed));
        }

        BindableStatement stmt = statementPreparer.prepare(parsed.sql());
        try {
            for (BindInstruction bind : parsed.binds()) {
                stmt.bindValue(bind.placeholder(), bind.value(), bind.type());
            }
        } catch (RuntimeException ex) {
            stmt.close();
            throw ex;
        }
        return stmt;
    }

    public BindableStatement prepareBind(String query) {
        return prepareBind(query, null);
    }

    /**
     * Runs a DML statement.
     *
     * @return affected row count, or empty if execution failed
     */
    public OptionalInt execute(String query, Params params) {
        try (BindableStatement stmt = prepareBind(query, params)) {
            return executed(stmt, query) ? OptionalInt.of(stmt.rowCount()) : OptionalInt.empty();
        }
    }

    public OptionalInt execute(String query) {
        return execute(query, null);
    }

    /** Same as {@link #execute(String, Params)}. */
    public OptionalInt exec(String query, Params params) {
        return execute(query, params);
    }

    /**
     * Runs a query and maps all rows.
     *
     * @return mapped rows, or empty if execution failed
     */
    public <T> Optional<List<T>> fetchAll(String query, Params params, RowMapper<T> rowMapper) {
        Objects.requireNonNull(rowMapper, "rowMapper");
        try (BindableStatement stmt = prepareBind(query, params)) {
            if (!executed(stmt, query)) {
                return Optional.empty();
            }
            return Optional.of(stmt.fetchAll(rowMapper));
        }
    }

    /** Rows as column-name maps. */
    public Optional<List<Map<String, Object>>> fetchAll(String query, Params params) {
        return fetchAll(query, params, RowMappers.columnMap());
    }

    /**
     * Runs a query and maps the first row, then releases the cursor.
     *
     * @return the first row, or empty if execution failed or no row matched
     */
    public <T> Optional<T> fetchOne(String query, Params params, RowMapper<T> rowMapper) {
        Objects.requireNonNull(rowMapper, "rowMapper");
        try (BindableStatement stmt = prepareBind(query, params)) {
            if (!executed(stmt, query)) {
                return Optional.empty();
            }
            T row = stmt.fetch(rowMapper);
            stmt.closeCursor();
            return Optional.ofNullable(row);
        }
    }

    /** First row as a column-name map. */
    public Optional<Map<String, Object>> fetchOne(String query, Params params) {
        return fetchOne(query, params, RowMappers.columnMap());
    }

    private boolean executed(BindableStatement stmt, String query) {
        try {
            if (stmt.execute()) {
                return true;
            }
            log.warn("Statement reported failure for [{}]", query);
            return false;
        } catch (DataAccessException ex) {
            log.warn("Execution failed for [{}]: {}", query, ex.getMessage(), ex);
            return false;
        }
    }
}
