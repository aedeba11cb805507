package com.enterprise.sqlbind.sql.param;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Renders bound values as SQL literals for debug output. Values passed
 * through this formatter are never sent to the database.
 */
public final class SqlLiteralFormatter {

    private SqlLiteralFormatter() {}

    /**
     * Formats a value the way it would be bound with the given type.
     * {@link BindType#STRING} quotes the value's string form, matching how
     * the driver receives it.
     */
    public static String format(Object value, BindType type) {
        if (value == null) {
            return "NULL";
        }
        switch (type) {
            case STRING:
                return quote(String.valueOf(value));
            case BOOL:
                if (value instanceof Boolean b) {
                    return b ? "TRUE" : "FALSE";
                }
                return format(value);
            default:
                return format(value);
        }
    }

    /**
     * Formats a Java value as a SQL literal based on its runtime type.
     *
     * @throws NullPointerException if value is null
     */
    public static String format(Object value) {
        if (value == null) {
            throw new NullPointerException("literal value must not be null");
        }

        if (value instanceof String s) {
            return quote(s);
        }
        if (value instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        if (value instanceof Number n) {
            return n.toString();
        }
        if (value instanceof Boolean b) {
            return b ? "TRUE" : "FALSE";
        }
        if (value instanceof LocalDate ld) {
            return "DATE '" + ld + "'";
        }
        return quote(value.toString());
    }

    private static String quote(String s) {
        return "'" + s.replace("'", "''") + "'";
    }
}
