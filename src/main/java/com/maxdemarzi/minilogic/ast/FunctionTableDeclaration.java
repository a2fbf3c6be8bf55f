package com.maxdemarzi.minilogic.ast;

import java.util.List;
import java.util.Objects;

public final class FunctionTableDeclaration extends Statement {
    private final String name;
    private final List<String> parameters;
    private final List<String> subparameters;
    private final List<TableRow> rows;

    public FunctionTableDeclaration(String name, List<String> parameters, List<String> subparameters,
                                    List<TableRow> rows, SourceRange range) {
        super(range);
        this.name = Objects.requireNonNull(name);
        this.parameters = List.copyOf(parameters);
        this.subparameters = List.copyOf(subparameters);
        this.rows = List.copyOf(rows);
    }

    public FunctionTableDeclaration(String name, List<String> parameters, List<String> subparameters,
                                    List<TableRow> rows) {
        this(name, parameters, subparameters, rows, SourceRange.NOT_SET);
    }

    public String getName() {
        return name;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public List<String> getSubparameters() {
        return subparameters;
    }

    public List<TableRow> getRows() {
        return rows;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFunctionTable(this);
    }

    @Override
    public String toString() {
        return name + "(" + String.join(", ", parameters) + ") = [" + rows.size() + " rows]";
    }
}
