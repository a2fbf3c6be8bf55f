package com.maxdemarzi.minilogic.gates;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.maxdemarzi.minilogic.ast.*;
import org.apache.commons.lang3.tuple.Triple;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Rewrites an expression into an equivalent one that only uses a single universal gate.
 * Literals and variables stay as they are, calls keep their shape with rewritten arguments.
 */
public final class GateSynthesizer {

    // Rewrites are pure, so results are shared between runs. Node equality ignores
    // positions, so the key also carries every range of the tree in visiting order.
    public static final LoadingCache<Triple<Expression, Gate, List<SourceRange>>, Expression> gateCache = Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterAccess(60, TimeUnit.MINUTES)
            .build(key -> rewrite(key.getLeft(), key.getMiddle()));

    private GateSynthesizer() {
    }

    public static Expression synthesize(Expression expression, Gate gate) {
        return gateCache.get(key(expression, gate));
    }

    static Triple<Expression, Gate, List<SourceRange>> key(Expression expression, Gate gate) {
        List<SourceRange> ranges = new ArrayList<>();
        expression.accept(new CollectRanges(ranges));
        return Triple.of(expression, gate, ranges);
    }

    static Expression rewrite(Expression expression, Gate gate) {
        return expression.accept(new Rewrite(gate));
    }

    private static final class Rewrite implements ExpressionVisitor<Expression> {
        private final Gate gate;

        Rewrite(Gate gate) {
            this.gate = gate;
        }

        private Expression g(Expression a, Expression b) {
            return new BinaryOperation(a, gate.getOperator(), b);
        }

        private Expression invert(Expression a) {
            return g(a, a);
        }

        private Expression and(Expression a, Expression b) {
            return gate == Gate.NAND ? invert(g(a, b)) : g(invert(a), invert(b));
        }

        private Expression or(Expression a, Expression b) {
            return gate == Gate.NAND ? g(invert(a), invert(b)) : invert(g(a, b));
        }

        // Four gates; gives XOR with NAND and XNOR with NOR
        private Expression chain(Expression a, Expression b) {
            Expression shared = g(a, b);
            return g(g(a, shared), g(b, shared));
        }

        @Override
        public Expression visitNumber(NumberLiteral number) {
            return number;
        }

        @Override
        public Expression visitString(StringLiteral string) {
            return string;
        }

        @Override
        public Expression visitVariable(Variable variable) {
            return variable;
        }

        @Override
        public Expression visitBinary(BinaryOperation binary) {
            Expression left = binary.getLeft().accept(this);
            Expression right = binary.getRight().accept(this);

            switch (binary.getOperator()) {
                case AND:
                    return and(left, right);
                case OR:
                    return or(left, right);
                case XOR:
                    return gate == Gate.NAND ? chain(left, right) : invert(chain(left, right));
                case XNOR:
                    return gate == Gate.NAND ? invert(chain(left, right)) : chain(left, right);
                case NAND:
                    return gate == Gate.NAND ? g(left, right) : invert(and(left, right));
                case NOR:
                    return gate == Gate.NOR ? g(left, right) : invert(or(left, right));
                case IMPLY:
                    // not a or b
                    return gate == Gate.NAND ? g(left, invert(right)) : invert(g(invert(left), right));
                case NIMPLY:
                    // a and not b
                    return gate == Gate.NAND ? invert(g(left, invert(right))) : g(invert(left), right);
                default:
                    throw new IllegalStateException("Unexpected binary operator " + binary.getOperator());
            }
        }

        @Override
        public Expression visitUnary(UnaryOperation unary) {
            return invert(unary.getOperand().accept(this));
        }

        @Override
        public Expression visitFunctionCall(FunctionCall call) {
            return call.withArguments(rewriteAll(call.getArguments()));
        }

        @Override
        public Expression visitBuiltinCall(BuiltinCall call) {
            return call.withParameters(rewriteAll(call.getParameters()));
        }

        @Override
        public Expression visitError(ErrorExpression error) {
            return error;
        }

        private List<Expression> rewriteAll(List<Expression> expressions) {
            return expressions.stream().map(e -> e.accept(this)).collect(Collectors.toList());
        }
    }

    private static final class CollectRanges implements ExpressionVisitor<Void> {
        private final List<SourceRange> ranges;

        CollectRanges(List<SourceRange> ranges) {
            this.ranges = ranges;
        }

        @Override
        public Void visitNumber(NumberLiteral number) {
            ranges.add(number.getRange());
            return null;
        }

        @Override
        public Void visitString(StringLiteral string) {
            ranges.add(string.getRange());
            return null;
        }

        @Override
        public Void visitVariable(Variable variable) {
            ranges.add(variable.getRange());
            return null;
        }

        @Override
        public Void visitBinary(BinaryOperation binary) {
            ranges.add(binary.getRange());
            binary.getLeft().accept(this);
            return binary.getRight().accept(this);
        }

        @Override
        public Void visitUnary(UnaryOperation unary) {
            ranges.add(unary.getRange());
            return unary.getOperand().accept(this);
        }

        @Override
        public Void visitFunctionCall(FunctionCall call) {
            ranges.add(call.getRange());
            call.getArguments().forEach(argument -> argument.accept(this));
            return null;
        }

        @Override
        public Void visitBuiltinCall(BuiltinCall call) {
            ranges.add(call.getRange());
            call.getParameters().forEach(parameter -> parameter.accept(this));
            return null;
        }

        @Override
        public Void visitError(ErrorExpression error) {
            ranges.add(error.getRange());
            return null;
        }
    }
}
