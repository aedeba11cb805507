package com.enterprise.sqlbind.sql.param;

import java.util.Objects;

/**
 * Target of a bind instruction: a 1-based {@code ?} position or a named
 * {@code :name} token.
 */
public sealed interface Placeholder permits Placeholder.Positional, Placeholder.Named {

    static Placeholder position(int position) {
        return new Positional(position);
    }

    static Placeholder name(String name) {
        return new Named(name);
    }

    /** 1-based index of a {@code ?} marker. */
    record Positional(int position) implements Placeholder {
        public Positional {
            if (position < 1) {
                throw new IllegalArgumentException("position must be >= 1: " + position);
            }
        }

        @Override
        public String toString() {
            return String.valueOf(position);
        }
    }

    /** Named placeholder; {@link #name()} has no leading colon. */
    record Named(String name) implements Placeholder {
        public Named {
            Objects.requireNonNull(name, "name");
            if (name.startsWith(":")) {
                name = name.substring(1);
            }
        }

        public String token() {
            return ":" + name;
        }

        @Override
        public String toString() {
            return token();
        }
    }
}
