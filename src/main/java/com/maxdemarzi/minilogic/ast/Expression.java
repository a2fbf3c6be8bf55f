package com.maxdemarzi.minilogic.ast;

/**
 * An immutable node of the expression tree. Equality is structural and ignores
 * the source range, so rewritten trees can be compared and cached.
 */
public abstract class Expression {
    private final SourceRange range;

    protected Expression(SourceRange range) {
        this.range = range == null ? SourceRange.NOT_SET : range;
    }

    public SourceRange getRange() {
        return range;
    }

    public abstract <R> R accept(ExpressionVisitor<R> visitor);
}
