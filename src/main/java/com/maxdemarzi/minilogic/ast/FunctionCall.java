package com.maxdemarzi.minilogic.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class FunctionCall extends Expression {
    private final String name;
    private final List<Expression> arguments;

    public FunctionCall(String name, List<Expression> arguments, SourceRange range) {
        super(range);
        this.name = Objects.requireNonNull(name);
        this.arguments = List.copyOf(arguments);
    }

    public FunctionCall(String name, List<Expression> arguments) {
        this(name, arguments, SourceRange.NOT_SET);
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public FunctionCall withArguments(List<Expression> newArguments) {
        return new FunctionCall(name, newArguments, getRange());
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof FunctionCall)) return false;
        FunctionCall other = (FunctionCall) o;
        return name.equals(other.name) && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arguments);
    }

    @Override
    public String toString() {
        return name + arguments.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
