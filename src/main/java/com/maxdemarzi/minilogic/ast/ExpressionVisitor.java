package com.maxdemarzi.minilogic.ast;

public interface ExpressionVisitor<R> {
    R visitNumber(NumberLiteral number);

    R visitString(StringLiteral string);

    R visitVariable(Variable variable);

    R visitBinary(BinaryOperation binary);

    R visitUnary(UnaryOperation unary);

    R visitFunctionCall(FunctionCall call);

    R visitBuiltinCall(BuiltinCall call);

    R visitError(ErrorExpression error);
}
