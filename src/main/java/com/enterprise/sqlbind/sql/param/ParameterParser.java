package com.enterprise.sqlbind.sql.param;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves a query and its {@link Params} into rewritten SQL plus an ordered
 * list of {@link BindInstruction}s.
 *
 * <p>Positional parameters bind to {@code ?} markers 1..n as strings.
 * Named parameter keys may carry a type suffix:
 * <ul>
 *   <li>{@code <i>}, {@code <s>}, {@code <b>} - single int, string or bool value</li>
 *   <li>{@code [i]}, {@code [s]}, {@code [b]} - array of ints, strings or bools</li>
 * </ul>
 * A non-empty array under a square-bracket suffix is flattened:
 * <pre>{@code
 * parse("SELECT col FROM tbl WHERE id IN(:id)", Params.named(":id[i]", List.of(5, 15)))
 *   -> "SELECT col FROM tbl WHERE id IN(:id0,:id1)"
 *      [(:id0, 5, INT), (:id1, 15, INT)]
 * }</pre>
 *
 * <p>Stateless and thread-safe.
 */
public class ParameterParser {

    public ParsedQuery parse(String query) {
        return parse(query, null);
    }

    /**
     * @throws MalformedParameterNameException if a named key does not match the grammar;
     *         nothing is produced in that case
     */
    public ParsedQuery parse(String query, Params params) {
        if (params == null || params.isEmpty()) {
            return new ParsedQuery(query, List.of());
        }

        ParameterBinder binder = new ParameterBinder();
        if (params instanceof Params.Positional positional) {
            for (Object value : positional.values()) {
                binder.bindPositional(value);
            }
            return new ParsedQuery(query, binder.getInstructions());
        }

        Params.Named named = (Params.Named) params;
        Map<String, String> rewrites = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : named.values().entrySet()) {
            ParameterKey key = ParameterKey.parse(entry.getKey());
            List<Object> elements = key.array() ? elementsOf(entry.getValue()) : null;

            if (elements != null && !elements.isEmpty()) {
                List<String> tokens = binder.bindEach(key.name(), elements, key.type());
                rewrites.putIfAbsent(key.name(), String.join(",", tokens));
            } else if (elements == null) {
                binder.bind(key.name(), entry.getValue(), key.type());
            }
            // empty array: nothing bound, placeholder left in place
        }

        return new ParsedQuery(SqlPlaceholders.replaceNamed(query, rewrites), binder.getInstructions());
    }

    /** Elements of a collection or Java array in iteration order, or null for scalars. */
    private static List<Object> elementsOf(Object value) {
        if (value instanceof Collection<?> c) {
            return new ArrayList<>(c);
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> out = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                out.add(Array.get(value, i));
            }
            return out;
        }
        return null;
    }
}
