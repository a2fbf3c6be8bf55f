package com.maxdemarzi.minilogic.runtime;

import com.maxdemarzi.minilogic.ast.*;
import org.neo4j.logging.Log;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;

/**
 * Evaluates expressions against the globals of an {@link Environment} and an optional
 * local scope holding the parameters of the function being called.
 */
public class Evaluator {
    private final Environment environment;
    private final InputSource input;
    private final Log log;
    private final int maxCallDepth;
    private int callDepth;

    public Evaluator(Environment environment, InputSource input, Log log, int maxCallDepth) {
        this.environment = environment;
        this.input = input;
        this.log = log;
        this.maxCallDepth = maxCallDepth;
    }

    public Environment getEnvironment() {
        return environment;
    }

    public Bit evaluate(Expression expression) {
        return evaluate(expression, Collections.emptyMap());
    }

    /**
     * Evaluates with the given parameter bindings. An empty scope behaves like the
     * top level, so a function without parameters reads globals directly.
     */
    public Bit evaluate(Expression expression, Map<String, Bit> locals) {
        return expression.accept(new Visit(Objects.requireNonNull(locals)));
    }

    private class Visit implements ExpressionVisitor<Bit> {
        private final Map<String, Bit> locals;

        Visit(Map<String, Bit> locals) {
            this.locals = locals;
        }

        @Override
        public Bit visitNumber(NumberLiteral number) {
            return number.getValue();
        }

        @Override
        public Bit visitString(StringLiteral string) {
            throw new MiniLogicException(ErrorKind.GRAMMAR_CONTRACT,
                    "String \"" + string.getValue() + "\" cannot be evaluated", string);
        }

        @Override
        public Bit visitVariable(Variable variable) {
            String name = variable.getName();

            // Inside a function only parameters are visible, globals need a reference
            if (!locals.isEmpty()) {
                if (variable.isReference()) {
                    if (!environment.hasVariable(name)) {
                        throw new MiniLogicException(ErrorKind.RESOLUTION_FAILURE,
                                "Reference " + name + " not defined", variable);
                    }
                    return environment.getVariable(name);
                }
                Bit value = locals.get(name);
                if (value == null) {
                    throw new MiniLogicException(ErrorKind.RESOLUTION_FAILURE,
                            "Parameter " + name + " not defined", variable);
                }
                return value;
            }

            if (variable.isReference()) {
                throw new MiniLogicException(ErrorKind.RESOLUTION_FAILURE,
                        "Variable " + name + " is a reference outside a function", variable);
            }
            if (!environment.hasVariable(name)) {
                throw new MiniLogicException(ErrorKind.RESOLUTION_FAILURE,
                        "Variable " + name + " not defined", variable);
            }
            return environment.getVariable(name);
        }

        @Override
        public Bit visitBinary(BinaryOperation binary) {
            Bit left = binary.getLeft().accept(this);
            Bit right = binary.getRight().accept(this);
            return binary.getOperator().apply(left, right);
        }

        @Override
        public Bit visitUnary(UnaryOperation unary) {
            return unary.getOperator().apply(unary.getOperand().accept(this));
        }

        @Override
        public Bit visitFunctionCall(FunctionCall call) {
            FunctionDeclaration function = environment.getFunction(call.getName());
            if (function == null) {
                throw new MiniLogicException(ErrorKind.RESOLUTION_FAILURE,
                        "Function " + call.getName() + " not defined", call);
            }
            List<String> parameters = function.getParameters();
            List<Expression> arguments = call.getArguments();
            if (parameters.size() != arguments.size()) {
                throw new MiniLogicException(ErrorKind.RESOLUTION_FAILURE,
                        "Function " + function.getName() + " expects " + parameters.size()
                                + " parameters, got " + arguments.size(), call);
            }

            // Arguments are evaluated in the caller's scope before the callee's is built
            LocalScope scope = new LocalScope();
            for (int i = 0; i < parameters.size(); i++) {
                scope.bind(parameters.get(i), arguments.get(i).accept(this));
            }

            if (callDepth >= maxCallDepth) {
                throw new MiniLogicException(ErrorKind.RESOLUTION_FAILURE,
                        "Call depth exceeded " + maxCallDepth + " while calling " + function.getName(), call);
            }
            callDepth++;
            try {
                return evaluate(function.getBody(), scope.asMap());
            } catch (StackOverflowError e) {
                // Deep bodies can exhaust the thread stack before the depth cap is reached
                throw new MiniLogicException(ErrorKind.RESOLUTION_FAILURE,
                        "Call stack exhausted at depth " + callDepth + " while calling " + function.getName(), call);
            } finally {
                callDepth--;
            }
        }

        @Override
        public Bit visitBuiltinCall(BuiltinCall call) {
            Builtin builtin = call.getBuiltin();
            if (!builtin.isExpression()) {
                throw new MiniLogicException(ErrorKind.UNSUPPORTED_OPERATION,
                        "Invalid builtin " + builtin + " in expression", call);
            }
            if (call.getParameters().size() != 1) {
                throw new MiniLogicException(ErrorKind.GRAMMAR_CONTRACT,
                        builtin + " expects 1 parameter, got " + call.getParameters().size(), call);
            }
            Expression parameter = call.getParameters().get(0);

            if (builtin == Builtin.INPUT) {
                return requestInput(call, parameter);
            }
            // Gate and solve builtins only change how an expression is shown, not its value
            return parameter.accept(this);
        }

        @Override
        public Bit visitError(ErrorExpression error) {
            throw new MiniLogicException(ErrorKind.GRAMMAR_CONTRACT, error.getMessage(), error);
        }
    }

    private Bit requestInput(BuiltinCall call, Expression parameter) {
        if (!(parameter instanceof StringLiteral)) {
            throw new MiniLogicException(ErrorKind.GRAMMAR_CONTRACT,
                    "INPUT expects a string prompt", call);
        }
        String prompt = ((StringLiteral) parameter).getValue();
        log.info("Waiting for input: %s", prompt);

        try {
            Bit value = input.request(prompt).toCompletableFuture().get();
            if (value == null) {
                throw new MiniLogicException(ErrorKind.INPUT_CANCELLED,
                        "No value given for input \"" + prompt + "\"", call);
            }
            return value;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MiniLogicException(ErrorKind.INPUT_CANCELLED,
                    "Interrupted while waiting for input \"" + prompt + "\"", call, e);
        } catch (CancellationException e) {
            throw new MiniLogicException(ErrorKind.INPUT_CANCELLED,
                    "Input \"" + prompt + "\" was cancelled", call, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new MiniLogicException(ErrorKind.INPUT_CANCELLED,
                    "Input \"" + prompt + "\" failed: " + cause.getMessage(), call, cause);
        }
    }
}
