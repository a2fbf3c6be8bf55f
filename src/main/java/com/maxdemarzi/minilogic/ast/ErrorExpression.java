package com.maxdemarzi.minilogic.ast;

/**
 * Placeholder left by the parser where an expression could not be read.
 * Must never reach evaluation.
 */
public final class ErrorExpression extends Expression {
    private final String message;

    public ErrorExpression(String message, SourceRange range) {
        super(range);
        this.message = message;
    }

    public ErrorExpression(String message) {
        this(message, SourceRange.NOT_SET);
    }

    public String getMessage() {
        return message;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitError(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ErrorExpression && ((ErrorExpression) o).message.equals(message);
    }

    @Override
    public int hashCode() {
        return message.hashCode();
    }

    @Override
    public String toString() {
        return "<error: " + message + ">";
    }
}
