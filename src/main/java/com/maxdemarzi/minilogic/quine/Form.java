package com.maxdemarzi.minilogic.quine;

import com.maxdemarzi.minilogic.ast.Builtin;

public enum Form {
    // sum of products
    SOP,
    // product of sums
    POS;

    public static Form forBuiltin(Builtin builtin) {
        switch (builtin) {
            case SOLVE_SOP:
                return SOP;
            case SOLVE_POS:
                return POS;
            default:
                throw new IllegalArgumentException(builtin + " does not name a two-level form");
        }
    }
}
