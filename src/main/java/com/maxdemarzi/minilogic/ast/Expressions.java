package com.maxdemarzi.minilogic.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Shorthand constructors for building trees in code, used by the compilers
 * and the minimizer when they generate expressions.
 */
public final class Expressions {
    public static final NumberLiteral ZERO = new NumberLiteral(Bit.ZERO);
    public static final NumberLiteral ONE = new NumberLiteral(Bit.ONE);

    private Expressions() {
    }

    public static NumberLiteral literal(Bit bit) {
        return bit.isSet() ? ONE : ZERO;
    }

    public static Variable var(String name) {
        return new Variable(name, false);
    }

    public static Variable ref(String name) {
        return new Variable(name, true);
    }

    public static StringLiteral string(String value) {
        return new StringLiteral(value);
    }

    public static UnaryOperation not(Expression operand) {
        return new UnaryOperation(Operator.NOT, operand);
    }

    public static BinaryOperation binary(Expression left, Operator operator, Expression right) {
        return new BinaryOperation(left, operator, right);
    }

    public static BinaryOperation and(Expression left, Expression right) {
        return binary(left, Operator.AND, right);
    }

    public static BinaryOperation or(Expression left, Expression right) {
        return binary(left, Operator.OR, right);
    }

    public static FunctionCall call(String name, Expression... arguments) {
        return new FunctionCall(name, Arrays.asList(arguments));
    }

    public static BuiltinCall builtin(Builtin builtin, Expression... parameters) {
        return new BuiltinCall(builtin, Arrays.asList(parameters));
    }

    // Left fold, so a, b, c becomes ((a op b) op c)
    public static Expression reduce(List<? extends Expression> terms, Operator operator, Expression empty) {
        if (terms.isEmpty()) {
            return empty;
        }
        Expression result = terms.get(0);
        for (int i = 1; i < terms.size(); i++) {
            result = binary(result, operator, terms.get(i));
        }
        return result;
    }
}
