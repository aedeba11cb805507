package com.enterprise.sqlbind.sql.param;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects bind instructions in the order they are produced.
 * {@link #bindEach(String, List, BindType)} mints {@code :name0, :name1, ...}
 * (index starts at 0) and returns the tokens for the query rewrite.
 * Not thread-safe; use one instance per parse.
 */
public class ParameterBinder {

    private final List<BindInstruction> instructions = new ArrayList<>();

    /** Binds a value to the next {@code ?} position (1-based), always as a string. */
    public int bindPositional(Object value) {
        int position = instructions.size() + 1;
        instructions.add(BindInstruction.positional(position, value));
        return position;
    }

    /** Binds a single value and returns its placeholder (e.g. ":status"). */
    public String bind(String name, Object value, BindType type) {
        instructions.add(BindInstruction.named(name, value, type));
        return ":" + name;
    }

    /** Binds every element under an indexed name and returns the minted tokens. */
    public List<String> bindEach(String name, List<?> elements, BindType type) {
        List<String> tokens = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            tokens.add(bind(name + i, elements.get(i), type));
        }
        return tokens;
    }

    public List<BindInstruction> getInstructions() {
        return Collections.unmodifiableList(new ArrayList<>(instructions));
    }
}
