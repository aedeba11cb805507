package com.enterprise.sqlbind.sql.param;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed named-parameter key such as {@code :id}, {@code name<s>} or
 * {@code :ids[i]}.
 *
 * @param name  base identifier without the leading colon
 * @param type  bind type resolved from the suffix letter
 * @param array true when the suffix uses square brackets
 */
public record ParameterKey(String name, BindType type, boolean array) {

    private static final Pattern KEY =
            Pattern.compile(":?(\\w+)(?:<(\\w?)>|\\[(\\w?)])?");

    public ParameterKey {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    /**
     * Parses a raw key.
     *
     * @throws MalformedParameterNameException if the key does not match the grammar
     */
    public static ParameterKey parse(String rawKey) {
        if (rawKey == null) {
            throw new MalformedParameterNameException(null);
        }
        Matcher m = KEY.matcher(rawKey);
        if (!m.matches()) {
            throw new MalformedParameterNameException(rawKey);
        }
        if (m.group(3) != null) {
            return new ParameterKey(m.group(1), BindType.fromLetter(m.group(3)), true);
        }
        return new ParameterKey(m.group(1), BindType.fromLetter(m.group(2)), false);
    }

    /** The placeholder as written in SQL, e.g. {@code :id}. */
    public String token() {
        return ":" + name;
    }
}
