package com.enterprise.sqlbind.sql.param;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output of {@link ParameterParser}: the rewritten SQL and its ordered binds.
 */
public class ParsedQuery {

    private final String sql;
    private final List<BindInstruction> binds;

    public ParsedQuery(String sql, List<BindInstruction> binds) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.binds = binds == null ? List.of() : List.copyOf(binds);
    }

    public String sql() { return sql; }

    public List<BindInstruction> binds() { return binds; }

    /** Returns the SQL with all bound values inlined, for debugging only. */
    public String toDebugString() {
        Map<String, String> named = new LinkedHashMap<>();
        List<String> positional = new ArrayList<>();
        for (BindInstruction bind : binds) {
            String literal = SqlLiteralFormatter.format(bind.value(), bind.type());
            if (bind.placeholder() instanceof Placeholder.Named n) {
                named.putIfAbsent(n.name(), literal);
            } else {
                positional.add(literal);
            }
        }
        String inlined = SqlPlaceholders.replaceNamed(sql, named);
        return SqlPlaceholders.replacePositional(inlined, positional);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParsedQuery other)) return false;
        return sql.equals(other.sql) && binds.equals(other.binds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, binds);
    }

    @Override
    public String toString() {
        return "ParsedQuery[sql=" + sql + ", binds=" + binds + "]";
    }
}
