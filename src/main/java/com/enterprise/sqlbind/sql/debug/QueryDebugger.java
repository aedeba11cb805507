package com.enterprise.sqlbind.sql.debug;

import com.enterprise.sqlbind.sql.param.BindInstruction;
import com.enterprise.sqlbind.sql.param.ParsedQuery;

/**
 * Debug utility: formats a {@link ParsedQuery} showing the rewritten SQL,
 * values-inlined SQL, and the bind list with types.
 */
public final class QueryDebugger {

    private QueryDebugger() {}

    public static String format(ParsedQuery query) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== SQL Query Debug ===\n");

        sb.append("SQL (rewritten):\n  ").append(query.sql()).append("\n");

        sb.append("SQL (values inlined):\n  ").append(query.toDebugString()).append("\n");

        sb.append("Binds (").append(query.binds().size()).append("):\n");
        for (BindInstruction bind : query.binds()) {
            Object val = bind.value();
            String javaType = val != null ? val.getClass().getSimpleName() : "null";
            sb.append("  ").append(bind.placeholder()).append(" = ").append(val)
                    .append(" (").append(bind.type()).append(", ").append(javaType).append(")\n");
        }
        sb.append("======================");
        return sb.toString();
    }
}
