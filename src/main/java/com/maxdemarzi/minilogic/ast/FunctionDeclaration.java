package com.maxdemarzi.minilogic.ast;

import java.util.List;
import java.util.Objects;

public final class FunctionDeclaration extends Statement {
    private final String name;
    private final List<String> parameters;
    private final Expression body;

    public FunctionDeclaration(String name, List<String> parameters, Expression body, SourceRange range) {
        super(range);
        this.name = Objects.requireNonNull(name);
        this.parameters = List.copyOf(parameters);
        this.body = Objects.requireNonNull(body);
    }

    public FunctionDeclaration(String name, List<String> parameters, Expression body) {
        this(name, parameters, body, SourceRange.NOT_SET);
    }

    public String getName() {
        return name;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public Expression getBody() {
        return body;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public String toString() {
        return name + "(" + String.join(", ", parameters) + ") = " + body;
    }
}
