package com.enterprise.sqlbind.sql.param;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.IntFunction;

/**
 * Lexical scanner for SQL placeholders.
 *
 * <p>Rules:
 * <ul>
 *   <li>A named placeholder is {@code ':'} followed by one or more word
 *       characters ({@code [A-Za-z0-9_]}); the whole run is the name.</li>
 *   <li>{@code '::'} is a cast, not a placeholder.</li>
 *   <li>Nothing inside single-quoted literals or double-quoted identifiers
 *       is a placeholder ({@code ''} and {@code ""} escapes are honoured).</li>
 *   <li>Line comments ({@code --} to end of line) and block comments
 *       ({@code /*} to {@code *}{@code /}) are copied through unchanged.</li>
 * </ul>
 */
public final class SqlPlaceholders {

    private SqlPlaceholders() {}

    /**
     * Replaces whole named placeholders in a single pass. Text produced by a
     * replacement is never scanned again.
     *
     * @param sql          query text
     * @param replacements placeholder name (no colon) to replacement text
     */
    public static String replaceNamed(String sql, Map<String, String> replacements) {
        if (sql == null || replacements.isEmpty()) {
            return sql;
        }
        return scan(sql, name -> {
            String replacement = replacements.get(name);
            return replacement != null ? replacement : ":" + name;
        }, null);
    }

    /**
     * Replaces {@code ?} markers by position; markers beyond the list are kept.
     */
    public static String replacePositional(String sql, List<String> replacements) {
        if (sql == null || replacements.isEmpty()) {
            return sql;
        }
        return scan(sql, name -> ":" + name,
                index -> index < replacements.size() ? replacements.get(index) : "?");
    }

    /**
     * Rewrites named placeholders into JDBC {@code ?} markers.
     * Existing {@code ?} markers are kept and reported with a {@code null} name.
     */
    public static JdbcSql compile(String sql) {
        if (sql == null) {
            return new JdbcSql("", List.of());
        }
        List<String> names = new ArrayList<>();
        String jdbcSql = scan(sql, name -> {
            names.add(name);
            return "?";
        }, index -> {
            names.add(null);
            return "?";
        });
        return new JdbcSql(jdbcSql, Collections.unmodifiableList(names));
    }

    private static String scan(String sql, Function<String, String> onNamed,
                               IntFunction<String> onMarker) {
        StringBuilder out = new StringBuilder(sql.length() + 16);
        int markers = 0;
        int i = 0;
        while (i < sql.length()) {
            char ch = sql.charAt(i);

            if (startsComment(sql, i)) {
                int end = skipComment(sql, i);
                out.append(sql, i, end);
                i = end;
                continue;
            }

            if (ch == '\'' || ch == '"') {
                int end = skipQuoted(sql, i, ch);
                out.append(sql, i, end);
                i = end;
                continue;
            }

            if (ch == ':') {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
                    out.append("::");
                    i += 2;
                    continue;
                }
                int end = i + 1;
                while (end < sql.length() && isWordChar(sql.charAt(end))) end++;
                if (end > i + 1) {
                    out.append(onNamed.apply(sql.substring(i + 1, end)));
                    i = end;
                    continue;
                }
            }

            if (ch == '?' && onMarker != null) {
                out.append(onMarker.apply(markers++));
                i++;
                continue;
            }
            out.append(ch);
            i++;
        }
        return out.toString();
    }

    private static boolean startsComment(String sql, int i) {
        if (i + 1 >= sql.length()) {
            return false;
        }
        char ch = sql.charAt(i);
        char next = sql.charAt(i + 1);
        return (ch == '-' && next == '-') || (ch == '/' && next == '*');
    }

    /** Returns the index just past the comment; a line comment keeps its newline outside. */
    private static int skipComment(String sql, int start) {
        if (sql.charAt(start) == '-') {
            int end = sql.indexOf('\n', start + 2);
            return end < 0 ? sql.length() : end;
        }
        int end = sql.indexOf("*/", start + 2);
        return end < 0 ? sql.length() : end + 2;
    }

    /** Returns the index just past the closing quote (or the end of input). */
    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                // doubled quote is an escape
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return i;
    }

    static boolean isWordChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z')
                || (c >= '0' && c <= '9') || c == '_';
    }

    /**
     * JDBC-ready SQL and, per {@code ?} marker (in order), the placeholder
     * name it came from or {@code null} for a marker that was already positional.
     */
    public record JdbcSql(String sql, List<String> names) {

        public boolean hasNamedParameters() {
            for (String name : names) {
                if (name != null) return true;
            }
            return false;
        }

        /** 1-based marker positions bound to {@code name}. */
        public List<Integer> positionsOf(String name) {
            List<Integer> positions = new ArrayList<>();
            for (int i = 0; i < names.size(); i++) {
                if (name.equals(names.get(i))) {
                    positions.add(i + 1);
                }
            }
            return positions;
        }
    }
}
