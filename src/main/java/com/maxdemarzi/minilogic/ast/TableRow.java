package com.maxdemarzi.minilogic.ast;

import java.util.Objects;

/**
 * One line of a function table: a fixed-width pattern of 0s and 1s and the
 * expression the function yields for it.
 */
public final class TableRow {
    private final String pattern;
    private final Expression value;

    public TableRow(String pattern, Expression value) {
        if (!pattern.matches("[01]+")) {
            throw new IllegalArgumentException("Table row pattern must be binary: " + pattern);
        }
        this.pattern = pattern;
        this.value = Objects.requireNonNull(value);
    }

    public String getPattern() {
        return pattern;
    }

    public int width() {
        return pattern.length();
    }

    public Bit bitAt(int index) {
        return Bit.of(pattern.charAt(index));
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public String toString() {
        return pattern + ", " + value;
    }
}
