package com.maxdemarzi.minilogic.show;

import com.maxdemarzi.minilogic.ast.*;
import com.maxdemarzi.minilogic.gates.Gate;
import com.maxdemarzi.minilogic.gates.GateSynthesizer;
import com.maxdemarzi.minilogic.quine.Form;
import com.maxdemarzi.minilogic.quine.Minimizer;
import com.maxdemarzi.minilogic.runtime.ErrorKind;
import com.maxdemarzi.minilogic.runtime.Evaluator;
import com.maxdemarzi.minilogic.runtime.MiniLogicException;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Renders expressions back to readable source text. Gate and solve builtins are shown
 * together with the expression they produce, e.g. {@code <TO_NAND>(not A) = (A nand A)}.
 */
public class ExpressionPrinter {
    private final Evaluator evaluator;
    private final Minimizer minimizer;
    private final boolean inlineFunctions;

    public ExpressionPrinter(Evaluator evaluator, Minimizer minimizer, boolean inlineFunctions) {
        this.evaluator = evaluator;
        this.minimizer = minimizer;
        this.inlineFunctions = inlineFunctions;
    }

    public String show(Expression expression) {
        return expression.accept(new Print(Collections.emptyMap(), new HashSet<>()));
    }

    private class Print implements ExpressionVisitor<String> {
        // Parameter name -> text of the argument it was called with
        private final Map<String, String> replacements;
        // Functions being inlined, so recursive ones stop at their own call
        private final Set<String> inlining;

        Print(Map<String, String> replacements, Set<String> inlining) {
            this.replacements = replacements;
            this.inlining = inlining;
        }

        @Override
        public String visitNumber(NumberLiteral number) {
            return number.getValue().toString();
        }

        @Override
        public String visitString(StringLiteral string) {
            return string.getValue();
        }

        @Override
        public String visitVariable(Variable variable) {
            if (!variable.isReference() && replacements.containsKey(variable.getName())) {
                return replacements.get(variable.getName());
            }
            return variable.toString();
        }

        @Override
        public String visitBinary(BinaryOperation binary) {
            return "(" + binary.getLeft().accept(this) + " " + binary.getOperator() + " "
                    + binary.getRight().accept(this) + ")";
        }

        @Override
        public String visitUnary(UnaryOperation unary) {
            return unary.getOperator() + " " + unary.getOperand().accept(this);
        }

        @Override
        public String visitFunctionCall(FunctionCall call) {
            List<String> arguments = call.getArguments().stream()
                    .map(argument -> argument.accept(this))
                    .collect(Collectors.toList());
            String text = call.getName() + "(" + String.join(", ", arguments) + ")";
            if (!inlineFunctions || inlining.contains(call.getName())) {
                return text;
            }

            FunctionDeclaration function = evaluator.getEnvironment().getFunction(call.getName());
            if (function == null) {
                throw new MiniLogicException(ErrorKind.RESOLUTION_FAILURE,
                        "Function " + call.getName() + " not defined", call);
            }
            if (function.getParameters().size() != arguments.size()) {
                throw new MiniLogicException(ErrorKind.RESOLUTION_FAILURE,
                        "Function " + function.getName() + " expects " + function.getParameters().size()
                                + " parameters, got " + arguments.size(), call);
            }

            Map<String, String> inner = new HashMap<>();
            for (int i = 0; i < arguments.size(); i++) {
                inner.put(function.getParameters().get(i), arguments.get(i));
            }
            Set<String> nested = new HashSet<>(inlining);
            nested.add(function.getName());
            return text + " = " + function.getBody().accept(new Print(inner, nested));
        }

        @Override
        public String visitBuiltinCall(BuiltinCall call) {
            Builtin builtin = call.getBuiltin();
            if (!builtin.isExpression()) {
                throw new MiniLogicException(ErrorKind.UNSUPPORTED_OPERATION,
                        "Invalid builtin " + builtin + " in expression", call);
            }
            String parameters = call.getParameters().stream()
                    .map(parameter -> parameter.accept(this))
                    .collect(Collectors.joining(", "));
            String text = "<" + builtin + ">(" + parameters + ")";
            if (builtin == Builtin.INPUT) {
                return text;
            }
            if (call.getParameters().size() != 1) {
                throw new MiniLogicException(ErrorKind.GRAMMAR_CONTRACT,
                        builtin + " expects 1 parameter, got " + call.getParameters().size(), call);
            }

            Expression parameter = call.getParameters().get(0);
            Expression produced;
            switch (builtin) {
                case TO_NAND:
                case TO_NOR:
                    produced = GateSynthesizer.synthesize(parameter, Gate.forBuiltin(builtin));
                    break;
                default:
                    if (readsInput(parameter, new HashSet<>())) {
                        throw new MiniLogicException(ErrorKind.UNSUPPORTED_OPERATION,
                                builtin + " cannot sample INPUT while showing", call);
                    }
                    produced = minimizer.solve(parameter, Form.forBuiltin(builtin), evaluator);
                    break;
            }
            return text + " = " + produced.accept(this);
        }

        @Override
        public String visitError(ErrorExpression error) {
            throw new MiniLogicException(ErrorKind.GRAMMAR_CONTRACT, error.getMessage(), error);
        }
    }

    // Solving samples every row, so an INPUT anywhere below would be requested once per row
    private boolean readsInput(Expression expression, Set<String> visited) {
        if (expression instanceof BuiltinCall) {
            BuiltinCall call = (BuiltinCall) expression;
            return call.getBuiltin() == Builtin.INPUT
                    || call.getParameters().stream().anyMatch(parameter -> readsInput(parameter, visited));
        }
        if (expression instanceof BinaryOperation) {
            BinaryOperation binary = (BinaryOperation) expression;
            return readsInput(binary.getLeft(), visited) || readsInput(binary.getRight(), visited);
        }
        if (expression instanceof UnaryOperation) {
            return readsInput(((UnaryOperation) expression).getOperand(), visited);
        }
        if (expression instanceof FunctionCall) {
            FunctionCall call = (FunctionCall) expression;
            if (call.getArguments().stream().anyMatch(argument -> readsInput(argument, visited))) {
                return true;
            }
            FunctionDeclaration function = evaluator.getEnvironment().getFunction(call.getName());
            return function != null && visited.add(function.getName()) && readsInput(function.getBody(), visited);
        }
        return false;
    }
}
