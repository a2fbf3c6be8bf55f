package com.maxdemarzi.minilogic.runtime;

import com.maxdemarzi.minilogic.ast.Builtin;
import com.maxdemarzi.minilogic.ast.Statement;

/**
 * Thrown for builtins the language reserves but the engine does not implement.
 */
public class UnsupportedBuiltinException extends MiniLogicException {
    private final Builtin builtin;

    public UnsupportedBuiltinException(Builtin builtin, Statement statement) {
        super(ErrorKind.UNSUPPORTED_OPERATION, builtin + " is not supported yet", statement);
        this.builtin = builtin;
    }

    public Builtin getBuiltin() {
        return builtin;
    }
}
