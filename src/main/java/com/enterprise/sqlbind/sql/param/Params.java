package com.enterprise.sqlbind.sql.param;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameters for one query: either an ordered list for {@code ?} placeholders
 * or an insertion-ordered map of keys for {@code :name} placeholders.
 * Null values are allowed in both forms.
 *
 * <pre>{@code
 * Params.positional(5, "Jon");
 * Params.named()
 *     .with(":ids[i]", List.of(1, 5, 15))
 *     .with("name", "Jon");
 * }</pre>
 */
public sealed interface Params permits Params.Positional, Params.Named {

    boolean isEmpty();

    static Positional none() {
        return new Positional(List.of());
    }

    static Positional positional(Object... values) {
        return new Positional(values == null ? List.of() : Arrays.asList(values));
    }

    static Positional positional(List<?> values) {
        return new Positional(values == null ? List.of() : values);
    }

    static Named named() {
        return new Named(Map.of());
    }

    /** Copies {@code values} in their iteration order. */
    static Named named(Map<String, ?> values) {
        return new Named(values == null ? Map.of() : values);
    }

    static Named named(String key, Object value) {
        return named().with(key, value);
    }

    final class Positional implements Params {

        private final List<Object> values;

        Positional(List<?> values) {
            this.values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        public List<Object> values() {
            return values;
        }

        @Override
        public boolean isEmpty() {
            return values.isEmpty();
        }

        @Override
        public String toString() {
            return "Positional" + values;
        }
    }

    final class Named implements Params {

        private final Map<String, Object> values;

        Named(Map<String, ?> values) {
            this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        public Map<String, Object> values() {
            return values;
        }

        /** Returns a copy with {@code key} appended (or replaced in place). */
        public Named with(String key, Object value) {
            Map<String, Object> copy = new LinkedHashMap<>(values);
            copy.put(key, value);
            return new Named(copy);
        }

        @Override
        public boolean isEmpty() {
            return values.isEmpty();
        }

        @Override
        public String toString() {
            return "Named" + values;
        }
    }
}
