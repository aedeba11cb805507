package com.enterprise.sqlbind.shared.statementbridge.adapter;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Statement settings under the {@code sqlbind} prefix.
 */
@ConfigurationProperties(prefix = "sqlbind")
public class SqlBindProperties {

    /** JDBC fetch size hint; 0 keeps the driver default. */
    private int fetchSize = 0;

    /** Query timeout in seconds; 0 means no timeout. */
    private int queryTimeout = 0;

    public int getFetchSize() { return fetchSize; }
    public void setFetchSize(int fetchSize) { this.fetchSize = fetchSize; }
    public int getQueryTimeout() { return queryTimeout; }
    public void setQueryTimeout(int queryTimeout) { this.queryTimeout = queryTimeout; }
}
