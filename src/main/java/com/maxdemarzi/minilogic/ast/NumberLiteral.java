package com.maxdemarzi.minilogic.ast;

public final class NumberLiteral extends Expression {
    private final Bit value;

    public NumberLiteral(Bit value, SourceRange range) {
        super(range);
        this.value = value;
    }

    public NumberLiteral(Bit value) {
        this(value, SourceRange.NOT_SET);
    }

    public Bit getValue() {
        return value;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NumberLiteral && ((NumberLiteral) o).value == value;
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
