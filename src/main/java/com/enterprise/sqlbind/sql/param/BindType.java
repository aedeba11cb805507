package com.enterprise.sqlbind.sql.param;

import java.sql.Types;

/**
 * Target type of a bound value, selected by the letter inside a key suffix
 * ({@code <i>}, {@code [b]}, ...). Unknown or missing letters bind as
 * {@link #STRING}.
 */
public enum BindType {

    INT(Types.BIGINT),
    STRING(Types.VARCHAR),
    BOOL(Types.BOOLEAN);

    private final int sqlType;

    BindType(int sqlType) {
        this.sqlType = sqlType;
    }

    /** The {@link java.sql.Types} code used when binding. */
    public int sqlType() {
        return sqlType;
    }

    /**
     * Resolves the type letter of a suffix.
     *
     * @param letter the letter between the brackets, may be null or empty
     */
    public static BindType fromLetter(String letter) {
        if ("i".equals(letter)) {
            return INT;
        }
        if ("b".equals(letter)) {
            return BOOL;
        }
        return STRING;
    }
}
