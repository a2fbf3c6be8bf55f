package com.maxdemarzi.minilogic.ast;

import java.util.Objects;

/**
 * Where a node came from in the source. Only carried along for editor tooling,
 * nothing in the engine reads it.
 */
public final class SourceRange {
    public static final SourceRange NOT_SET = new SourceRange(Position.NOT_SET, Position.NOT_SET);

    private final Position start;
    private final Position end;

    public SourceRange(Position start, Position end) {
        this.start = Objects.requireNonNull(start);
        this.end = Objects.requireNonNull(end);
    }

    public Position getStart() {
        return start;
    }

    public Position getEnd() {
        return end;
    }

    public boolean isSet() {
        return start.isSet() && end.isSet();
    }

    public static SourceRange span(SourceRange a, SourceRange b) {
        return new SourceRange(Position.min(a.start, b.start), Position.max(a.end, b.end));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceRange)) return false;
        SourceRange other = (SourceRange) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
