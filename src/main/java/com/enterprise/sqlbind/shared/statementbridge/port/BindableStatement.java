package com.enterprise.sqlbind.shared.statementbridge.port;

import com.enterprise.sqlbind.sql.param.BindType;
import com.enterprise.sqlbind.sql.param.Placeholder;

import org.springframework.jdbc.core.RowMapper;

import java.util.List;

/**
 * A prepared statement as seen by the binding layer.
 *
 * <p>Typical lifecycle:
 * <pre>{@code
 * try (BindableStatement stmt = preparer.prepare("SELECT name FROM tbl WHERE id = :id")) {
 *     stmt.bindValue(Placeholder.name("id"), 1, BindType.INT);
 *     if (stmt.execute()) {
 *         List<String> names = stmt.fetchAll((rs, rowNum) -> rs.getString(1));
 *     }
 * }
 * }</pre>
 */
public interface BindableStatement extends AutoCloseable {

    /** Binds a value by 1-based position or by {@code :name}. */
    void bindValue(Placeholder placeholder, Object value, BindType type);

    /**
     * Executes with the current binds.
     *
     * @return true on success, false if the statement could not be executed
     */
    boolean execute();

    /** Maps every remaining row of the current result, then releases the cursor. */
    <T> List<T> fetchAll(RowMapper<T> rowMapper);

    /** Maps the next row of the current result, or returns null when there is none. */
    <T> T fetch(RowMapper<T> rowMapper);

    /** Rows affected by the last execution. */
    int rowCount();

    /** Releases the current result so the statement can be executed again. */
    void closeCursor();

    @Override
    void close();
}
