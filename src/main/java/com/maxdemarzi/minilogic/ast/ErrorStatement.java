package com.maxdemarzi.minilogic.ast;

public final class ErrorStatement extends Statement {
    private final String message;

    public ErrorStatement(String message, SourceRange range) {
        super(range);
        this.message = message;
    }

    public ErrorStatement(String message) {
        this(message, SourceRange.NOT_SET);
    }

    public String getMessage() {
        return message;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitError(this);
    }

    @Override
    public String toString() {
        return "<error: " + message + ">";
    }
}
