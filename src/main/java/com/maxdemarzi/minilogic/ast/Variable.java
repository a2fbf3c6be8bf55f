package com.maxdemarzi.minilogic.ast;

import java.util.Objects;

public final class Variable extends Expression {
    private final String name;
    // A reference (written NAME*) resolves against the globals from inside a function
    private final boolean reference;

    public Variable(String name, boolean reference, SourceRange range) {
        super(range);
        this.name = Objects.requireNonNull(name);
        this.reference = reference;
    }

    public Variable(String name, boolean reference) {
        this(name, reference, SourceRange.NOT_SET);
    }

    public String getName() {
        return name;
    }

    public boolean isReference() {
        return reference;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Variable)) return false;
        Variable other = (Variable) o;
        return name.equals(other.name) && reference == other.reference;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, reference);
    }

    @Override
    public String toString() {
        return reference ? name + "*" : name;
    }
}
