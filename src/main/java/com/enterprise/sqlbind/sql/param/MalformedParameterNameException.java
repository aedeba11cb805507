package com.enterprise.sqlbind.sql.param;

/**
 * Thrown when a named parameter key does not follow the
 * {@code [:]name[<t>|[t]]} grammar. No query or bind list is produced.
 */
public class MalformedParameterNameException extends IllegalArgumentException {

    private final String parameterName;

    public MalformedParameterNameException(String parameterName) {
        super("Invalid param name: " + parameterName);
        this.parameterName = parameterName;
    }

    public String getParameterName() {
        return parameterName;
    }
}
