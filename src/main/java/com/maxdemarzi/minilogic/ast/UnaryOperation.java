package com.maxdemarzi.minilogic.ast;

import java.util.Objects;

public final class UnaryOperation extends Expression {
    private final Operator operator;
    private final Expression operand;

    public UnaryOperation(Operator operator, Expression operand, SourceRange range) {
        super(range);
        if (!operator.isUnary()) {
            throw new IllegalArgumentException(operator + " is not a unary operator");
        }
        this.operator = operator;
        this.operand = Objects.requireNonNull(operand);
    }

    public UnaryOperation(Operator operator, Expression operand) {
        this(operator, operand, operand.getRange());
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof UnaryOperation)) return false;
        UnaryOperation other = (UnaryOperation) o;
        return operator == other.operator && operand.equals(other.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    @Override
    public String toString() {
        return operator + " " + operand;
    }
}
