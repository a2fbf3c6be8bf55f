package com.maxdemarzi.minilogic.gates;

import com.maxdemarzi.minilogic.ast.Builtin;
import com.maxdemarzi.minilogic.ast.Operator;

public enum Gate {
    NAND(Operator.NAND),
    NOR(Operator.NOR);

    private final Operator operator;

    Gate(Operator operator) {
        this.operator = operator;
    }

    public Operator getOperator() {
        return operator;
    }

    public static Gate forBuiltin(Builtin builtin) {
        switch (builtin) {
            case TO_NAND:
                return NAND;
            case TO_NOR:
                return NOR;
            default:
                throw new IllegalArgumentException(builtin + " does not name a gate");
        }
    }
}
