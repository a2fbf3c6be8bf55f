package com.maxdemarzi.minilogic.ast;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public final class BuiltinStatement extends Statement {
    private final Builtin builtin;
    private final List<Expression> parameters;

    public BuiltinStatement(Builtin builtin, List<Expression> parameters, SourceRange range) {
        super(range);
        this.builtin = Objects.requireNonNull(builtin);
        this.parameters = List.copyOf(parameters);
    }

    public BuiltinStatement(Builtin builtin, List<Expression> parameters) {
        this(builtin, parameters, SourceRange.NOT_SET);
    }

    public Builtin getBuiltin() {
        return builtin;
    }

    public List<Expression> getParameters() {
        return parameters;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBuiltin(this);
    }

    @Override
    public String toString() {
        return builtin + parameters.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
