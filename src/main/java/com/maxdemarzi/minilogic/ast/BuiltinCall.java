package com.maxdemarzi.minilogic.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class BuiltinCall extends Expression {
    private final Builtin builtin;
    private final List<Expression> parameters;

    public BuiltinCall(Builtin builtin, List<Expression> parameters, SourceRange range) {
        super(range);
        this.builtin = Objects.requireNonNull(builtin);
        this.parameters = List.copyOf(parameters);
    }

    public BuiltinCall(Builtin builtin, List<Expression> parameters) {
        this(builtin, parameters, SourceRange.NOT_SET);
    }

    public Builtin getBuiltin() {
        return builtin;
    }

    public List<Expression> getParameters() {
        return parameters;
    }

    public BuiltinCall withParameters(List<Expression> newParameters) {
        return new BuiltinCall(builtin, newParameters, getRange());
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBuiltinCall(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BuiltinCall)) return false;
        BuiltinCall other = (BuiltinCall) o;
        return builtin == other.builtin && parameters.equals(other.parameters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(builtin, parameters);
    }

    @Override
    public String toString() {
        return builtin + parameters.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
