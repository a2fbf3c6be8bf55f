package com.maxdemarzi.minilogic.ast;

public interface StatementVisitor<R> {
    R visitVariable(VariableDeclaration declaration);

    R visitFunction(FunctionDeclaration declaration);

    R visitFunctionTable(FunctionTableDeclaration declaration);

    R visitBuiltin(BuiltinStatement statement);

    R visitError(ErrorStatement error);
}
