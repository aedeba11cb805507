package com.enterprise.sqlbind.shared.statementbridge.port;

/**
 * Prepares SQL into a statement that accepts typed binds.
 *
 * <p>Implementations report driver failures as unchecked
 * {@link org.springframework.dao.DataAccessException}s.
 */
@FunctionalInterface
public interface StatementPreparer {

    /**
     * @param sql SQL with either {@code ?} or {@code :name} placeholders
     * @return a statement owned by the caller, who must close it
     */
    BindableStatement prepare(String sql);
}
