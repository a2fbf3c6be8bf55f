package com.maxdemarzi.minilogic.ast;

public abstract class Statement {
    private final SourceRange range;

    protected Statement(SourceRange range) {
        this.range = range == null ? SourceRange.NOT_SET : range;
    }

    public SourceRange getRange() {
        return range;
    }

    public abstract <R> R accept(StatementVisitor<R> visitor);
}
