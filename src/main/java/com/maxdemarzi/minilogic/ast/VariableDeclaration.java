package com.maxdemarzi.minilogic.ast;

import java.util.Objects;

public final class VariableDeclaration extends Statement {
    private final String name;
    private final Expression value;

    public VariableDeclaration(String name, Expression value, SourceRange range) {
        super(range);
        this.name = Objects.requireNonNull(name);
        this.value = Objects.requireNonNull(value);
    }

    public VariableDeclaration(String name, Expression value) {
        this(name, value, SourceRange.NOT_SET);
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public String toString() {
        return name + " = " + value;
    }
}
