package com.maxdemarzi.minilogic.ast;

import java.util.Objects;

public final class BinaryOperation extends Expression {
    private final Expression left;
    private final Operator operator;
    private final Expression right;

    public BinaryOperation(Expression left, Operator operator, Expression right, SourceRange range) {
        super(range);
        if (operator.isUnary()) {
            throw new IllegalArgumentException(operator + " is not a binary operator");
        }
        this.left = Objects.requireNonNull(left);
        this.operator = operator;
        this.right = Objects.requireNonNull(right);
    }

    public BinaryOperation(Expression left, Operator operator, Expression right) {
        this(left, operator, right, SourceRange.span(left.getRange(), right.getRange()));
    }

    public Expression getLeft() {
        return left;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BinaryOperation)) return false;
        BinaryOperation other = (BinaryOperation) o;
        return operator == other.operator && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
