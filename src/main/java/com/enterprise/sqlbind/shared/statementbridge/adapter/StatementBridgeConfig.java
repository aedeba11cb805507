package com.enterprise.sqlbind.shared.statementbridge.adapter;

import com.enterprise.sqlbind.shared.statementbridge.port.StatementPreparer;
import com.enterprise.sqlbind.sql.binder.SqlBinder;
import com.enterprise.sqlbind.sql.param.ParameterParser;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Wires the binding layer onto the application {@link DataSource}.
 *
 * <p>Import this configuration or let component scanning pick it up:
 * <pre>{@code
 * @Import(StatementBridgeConfig.class)
 * @Configuration
 * public class MyConfig { ... }
 * }</pre>
 *
 * <p>Tune statements through {@code sqlbind.fetch-size} and
 * {@code sqlbind.query-timeout}.
 */
@Configuration
@EnableConfigurationProperties(SqlBindProperties.class)
public class StatementBridgeConfig {

    @Bean
    public ParameterParser parameterParser() {
        return new ParameterParser();
    }

    @Bean
    public StatementPreparer statementPreparer(DataSource dataSource, SqlBindProperties props) {
        JdbcStatementPreparer preparer = new JdbcStatementPreparer(dataSource);
        preparer.setFetchSize(props.getFetchSize());
        preparer.setQueryTimeout(props.getQueryTimeout());
        return preparer;
    }

    @Bean
    public SqlBinder sqlBinder(StatementPreparer statementPreparer, ParameterParser parameterParser) {
        return new SqlBinder(statementPreparer, parameterParser);
    }
}
