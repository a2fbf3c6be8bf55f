package com.maxdemarzi.minilogic.ast;

public enum Builtin {
    PRINT(false, true),
    SHOW(false, true),
    TABLE(false, true),
    GRAPH(false, false),
    EXPORT(false, false),
    IMPORT(false, false),
    INPUT(true, true),
    TO_NAND(true, true),
    TO_NOR(true, true),
    SOLVE_SOP(true, true),
    SOLVE_POS(true, true);

    private final boolean expression;
    private final boolean supported;

    Builtin(boolean expression, boolean supported) {
        this.expression = expression;
        this.supported = supported;
    }

    // Only these may appear inside an expression, the rest are statements.
    public boolean isExpression() {
        return expression;
    }

    public boolean isSupported() {
        return supported;
    }
}
