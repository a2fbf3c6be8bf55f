package com.maxdemarzi.minilogic.ast;

public final class StringLiteral extends Expression {
    private final String value;

    public StringLiteral(String value, SourceRange range) {
        super(range);
        this.value = value;
    }

    public StringLiteral(String value) {
        this(value, SourceRange.NOT_SET);
    }

    public String getValue() {
        return value;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitString(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StringLiteral && ((StringLiteral) o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return '"' + value + '"';
    }
}
