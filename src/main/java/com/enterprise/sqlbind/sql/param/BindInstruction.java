package com.enterprise.sqlbind.sql.param;

import java.util.Objects;

/**
 * One resolved bind: where the value goes, the scalar value and its type.
 */
public record BindInstruction(Placeholder placeholder, Object value, BindType type) {

    public BindInstruction {
        Objects.requireNonNull(placeholder, "placeholder");
        Objects.requireNonNull(type, "type");
    }

    public static BindInstruction positional(int position, Object value) {
        return new BindInstruction(Placeholder.position(position), value, BindType.STRING);
    }

    public static BindInstruction named(String name, Object value, BindType type) {
        return new BindInstruction(Placeholder.name(name), value, type);
    }
}
