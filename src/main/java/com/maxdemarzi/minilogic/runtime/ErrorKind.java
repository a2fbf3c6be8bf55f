package com.maxdemarzi.minilogic.runtime;

public enum ErrorKind {
    // duplicate or ambiguous variable/function names
    DECLARATION_CONFLICT,
    // undefined names, arity mismatch, misplaced references, call depth
    RESOLUTION_FAILURE,
    // error placeholders and nodes that may not be evaluated
    GRAMMAR_CONTRACT,
    // GRAPH/EXPORT/IMPORT and builtins used out of place
    UNSUPPORTED_OPERATION,
    // the input source failed or was cancelled
    INPUT_CANCELLED
}
