package com.maxdemarzi.minilogic.ast;

import java.util.Objects;

public final class Position {
    public static final Position NOT_SET = new Position(-1, -1, -1);

    private final int line;
    private final int column;
    private final int offset;

    public Position(int line, int column, int offset) {
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getOffset() {
        return offset;
    }

    public boolean isSet() {
        return line != -1 && column != -1 && offset != -1;
    }

    // An unset position never wins over a set one
    public static Position min(Position a, Position b) {
        if (!a.isSet()) return b;
        if (!b.isSet()) return a;
        return a.offset <= b.offset ? a : b;
    }

    public static Position max(Position a, Position b) {
        if (!a.isSet()) return b;
        if (!b.isSet()) return a;
        return a.offset >= b.offset ? a : b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position)) return false;
        Position other = (Position) o;
        return line == other.line && column == other.column && offset == other.offset;
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, column, offset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
