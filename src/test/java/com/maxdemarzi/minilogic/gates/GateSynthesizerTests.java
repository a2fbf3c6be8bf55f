package com.maxdemarzi.minilogic.gates;

import com.maxdemarzi.minilogic.JboolOracle;
import com.maxdemarzi.minilogic.ast.*;
import com.maxdemarzi.minilogic.runtime.Environment;
import com.maxdemarzi.minilogic.runtime.Evaluator;
import com.maxdemarzi.minilogic.runtime.InputSource;
import com.maxdemarzi.minilogic.runtime.LocalScope;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.neo4j.logging.NullLog;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static com.maxdemarzi.minilogic.ast.Expressions.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

public class GateSynthesizerTests {

    private static final List<String> VARIABLES = List.of("A", "B", "C");

    private final Environment environment = new Environment();
    private final Evaluator evaluator = new Evaluator(environment, InputSource.NONE, NullLog.getInstance(), 100);

    private Bit evaluate(Expression expression, int row) {
        LocalScope scope = new LocalScope();
        for (int j = 0; j < VARIABLES.size(); j++) {
            scope.bind(VARIABLES.get(j), Bit.of(((row >> (VARIABLES.size() - 1 - j)) & 1) == 1));
        }
        return evaluator.evaluate(expression, scope.asMap());
    }

    private void assertEquivalent(Expression source, Expression rewritten) {
        for (int row = 0; row < (1 << VARIABLES.size()); row++) {
            assertEquals(evaluate(source, row), evaluate(rewritten, row), source + " at row " + row);
        }
    }

    private static Set<Operator> operatorsIn(Expression expression) {
        Set<Operator> operators = EnumSet.noneOf(Operator.class);
        expression.accept(new ExpressionVisitor<Void>() {
            @Override
            public Void visitNumber(NumberLiteral number) {
                return null;
            }

            @Override
            public Void visitString(StringLiteral string) {
                return null;
            }

            @Override
            public Void visitVariable(Variable variable) {
                return null;
            }

            @Override
            public Void visitBinary(BinaryOperation binary) {
                operators.add(binary.getOperator());
                binary.getLeft().accept(this);
                return binary.getRight().accept(this);
            }

            @Override
            public Void visitUnary(UnaryOperation unary) {
                operators.add(unary.getOperator());
                return unary.getOperand().accept(this);
            }

            @Override
            public Void visitFunctionCall(FunctionCall call) {
                call.getArguments().forEach(a -> a.accept(this));
                return null;
            }

            @Override
            public Void visitBuiltinCall(BuiltinCall call) {
                call.getParameters().forEach(p -> p.accept(this));
                return null;
            }

            @Override
            public Void visitError(ErrorExpression error) {
                return null;
            }
        });
        return operators;
    }

    private static List<Expression> samples() {
        List<Expression> samples = new ArrayList<>();
        for (Operator operator : Operator.values()) {
            if (operator.isUnary()) {
                samples.add(not(var("A")));
            } else {
                samples.add(binary(var("A"), operator, var("B")));
            }
        }
        samples.add(binary(or(var("A"), not(var("B"))), Operator.XOR, binary(var("C"), Operator.IMPLY, var("A"))));
        samples.add(not(binary(binary(var("A"), Operator.NIMPLY, var("C")), Operator.XNOR, and(var("B"), var("C")))));
        samples.add(binary(not(not(var("A"))), Operator.NOR, binary(var("B"), Operator.NAND, ONE)));
        return samples;
    }

    @ParameterizedTest
    @EnumSource(Gate.class)
    void shouldPreserveTruthTable(Gate gate) {
        for (Expression sample : samples()) {
            assertEquivalent(sample, GateSynthesizer.synthesize(sample, gate));
        }
    }

    @ParameterizedTest
    @EnumSource(Gate.class)
    void shouldOnlyUseTargetGate(Gate gate) {
        for (Expression sample : samples()) {
            assertThat(operatorsIn(GateSynthesizer.synthesize(sample, gate)))
                    .as("%s", sample)
                    .containsOnly(gate.getOperator());
        }
    }

    @ParameterizedTest
    @EnumSource(Gate.class)
    void shouldAgreeWithIndependentEvaluation(Gate gate) {
        Expression sample = binary(and(var("A"), var("B")), Operator.XOR, binary(var("C"), Operator.NIMPLY, var("B")));
        Expression rewritten = GateSynthesizer.synthesize(sample, gate);
        for (int row = 0; row < 8; row++) {
            assertEquals(JboolOracle.evaluate(sample, VARIABLES, row), evaluate(rewritten, row).isSet(), "row " + row);
        }
    }

    @Test
    void shouldInvertWithSingleGate() {
        assertEquals(binary(var("A"), Operator.NAND, var("A")), GateSynthesizer.synthesize(not(var("A")), Gate.NAND));
        assertEquals(binary(var("A"), Operator.NOR, var("A")), GateSynthesizer.synthesize(not(var("A")), Gate.NOR));
    }

    @Test
    void shouldKeepNativeGateAsIs() {
        Expression nand = binary(var("A"), Operator.NAND, var("B"));
        Expression nor = binary(var("A"), Operator.NOR, var("B"));

        assertEquals(nand, GateSynthesizer.synthesize(nand, Gate.NAND));
        assertEquals(nor, GateSynthesizer.synthesize(nor, Gate.NOR));
    }

    @Test
    void shouldLeaveLeavesUntouched() {
        assertSame(ONE, GateSynthesizer.synthesize(ONE, Gate.NAND));
        assertEquals(var("A"), GateSynthesizer.synthesize(var("A"), Gate.NOR));
        assertEquals(ref("A"), GateSynthesizer.synthesize(ref("A"), Gate.NAND));
    }

    @Test
    void shouldRewriteCallArgumentsOnly() {
        FunctionDeclaration function = new FunctionDeclaration("F", List.of("X"), and(var("X"), ONE));
        environment.declareFunction(function, function);

        Expression rewritten = GateSynthesizer.synthesize(call("F", not(var("A"))), Gate.NAND);

        assertEquals(call("F", binary(var("A"), Operator.NAND, var("A"))), rewritten);
        assertEquals(evaluate(call("F", not(var("A"))), 0), evaluate(rewritten, 0));
    }

    @Test
    void shouldSpanRangesOfRewrittenChildren() {
        Variable a = new Variable("A", false, new SourceRange(new Position(1, 1, 0), new Position(1, 2, 1)));
        Variable b = new Variable("B", false, new SourceRange(new Position(1, 7, 6), new Position(1, 8, 7)));

        Expression rewritten = GateSynthesizer.rewrite(and(a, b), Gate.NOR);

        assertEquals(0, rewritten.getRange().getStart().getOffset());
        assertEquals(7, rewritten.getRange().getEnd().getOffset());
    }

    @Test
    void shouldCacheRewrites() {
        Expression sample = binary(var("P"), Operator.XNOR, var("Q"));

        Expression first = GateSynthesizer.synthesize(sample, Gate.NOR);
        Expression second = GateSynthesizer.synthesize(binary(var("P"), Operator.XNOR, var("Q")), Gate.NOR);

        assertSame(first, second);
        assertThat(GateSynthesizer.gateCache.getIfPresent(GateSynthesizer.key(sample, Gate.NOR)))
                .isSameAs(first);
    }

    private static Variable located(String name, int offset) {
        return new Variable(name, false,
                new SourceRange(new Position(1, offset + 1, offset), new Position(1, offset + 2, offset + 1)));
    }

    @Test
    void shouldKeepRangesOfEachSourceWhenCached() {
        Expression early = GateSynthesizer.synthesize(and(located("A", 0), located("B", 6)), Gate.NAND);
        Expression late = GateSynthesizer.synthesize(and(located("A", 100), located("B", 106)), Gate.NAND);

        assertEquals(early, late);
        assertEquals(0, early.getRange().getStart().getOffset());
        assertEquals(7, early.getRange().getEnd().getOffset());
        assertEquals(100, late.getRange().getStart().getOffset());
        assertEquals(107, late.getRange().getEnd().getOffset());
        assertSame(late, GateSynthesizer.synthesize(and(located("A", 100), located("B", 106)), Gate.NAND));
    }

    @Test
    void shouldMapBuiltins() {
        assertEquals(Gate.NAND, Gate.forBuiltin(Builtin.TO_NAND));
        assertEquals(Gate.NOR, Gate.forBuiltin(Builtin.TO_NOR));
    }
}
