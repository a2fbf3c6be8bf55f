package com.maxdemarzi.minilogic.runtime;

import com.maxdemarzi.minilogic.ast.Expression;
import com.maxdemarzi.minilogic.ast.Statement;

/**
 * Raised for anything that stops a run. A run never recovers from one of these,
 * the interpreter reports it along with the statement that was executing.
 */
public class MiniLogicException extends RuntimeException {
    private final ErrorKind kind;
    private final Expression expression;
    private Statement statement;

    public MiniLogicException(ErrorKind kind, String message, Expression expression) {
        super(message);
        this.kind = kind;
        this.expression = expression;
    }

    public MiniLogicException(ErrorKind kind, String message, Statement statement) {
        super(message);
        this.kind = kind;
        this.expression = null;
        this.statement = statement;
    }

    public MiniLogicException(ErrorKind kind, String message, Expression expression, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.expression = expression;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Expression getExpression() {
        return expression;
    }

    public Statement getStatement() {
        return statement;
    }

    // Keeps the innermost statement if one was already recorded
    public MiniLogicException attach(Statement executing) {
        if (statement == null) {
            statement = executing;
        }
        return this;
    }
}
