package com.maxdemarzi.minilogic.show;

import com.maxdemarzi.minilogic.ast.*;
import com.maxdemarzi.minilogic.quine.Minimizer;
import com.maxdemarzi.minilogic.runtime.*;
import org.junit.jupiter.api.Test;
import org.neo4j.logging.NullLog;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static com.maxdemarzi.minilogic.ast.Expressions.*;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class ExpressionPrinterTests {

    private final Environment environment = new Environment();
    private final Evaluator evaluator = new Evaluator(environment, InputSource.NONE, NullLog.getInstance(), 100);
    private final Minimizer minimizer = new Minimizer(NullLog.getInstance());

    private ExpressionPrinter printer(boolean inline) {
        return new ExpressionPrinter(evaluator, minimizer, inline);
    }

    private void declare(String name, List<String> parameters, Expression body) {
        FunctionDeclaration function = new FunctionDeclaration(name, parameters, body);
        environment.declareFunction(function, function);
    }

    @Test
    void shouldPrintOperatorsFullyParenthesized() {
        ExpressionPrinter printer = printer(false);

        assertEquals("(A and B)", printer.show(and(var("A"), var("B"))));
        assertEquals("not A", printer.show(not(var("A"))));
        assertEquals("not (A xor 1)", printer.show(not(binary(var("A"), Operator.XOR, ONE))));
        assertEquals("((A imply B*) nor 0)", printer.show(binary(binary(var("A"), Operator.IMPLY, ref("B")), Operator.NOR, ZERO)));
        assertEquals("hello world", printer.show(string("hello world")));
    }

    @Test
    void shouldShowGateRewrite() {
        assertEquals("<TO_NAND>(not A) = (A nand A)", printer(false).show(builtin(Builtin.TO_NAND, not(var("A")))));
        assertEquals("<TO_NOR>(not A) = (A nor A)", printer(false).show(builtin(Builtin.TO_NOR, not(var("A")))));
    }

    @Test
    void shouldShowSolvedForms() {
        Expression absorbed = or(var("A"), and(var("A"), var("B")));

        assertEquals("<SOLVE_SOP>((A or (A and B))) = A", printer(false).show(builtin(Builtin.SOLVE_SOP, absorbed)));
        assertEquals("<SOLVE_POS>((A or B)) = (A or B)",
                printer(false).show(builtin(Builtin.SOLVE_POS, or(var("A"), var("B")))));
        assertEquals("<SOLVE_SOP>((A and not A)) = 0",
                printer(false).show(builtin(Builtin.SOLVE_SOP, and(var("A"), not(var("A"))))));
    }

    @Test
    void shouldShowNestedBuiltins() {
        Expression nested = builtin(Builtin.TO_NAND, builtin(Builtin.SOLVE_SOP, not(var("A"))));

        assertEquals("<TO_NAND>(<SOLVE_SOP>(not A) = not A) = <SOLVE_SOP>((A nand A)) = not A",
                printer(false).show(nested));
    }

    @Test
    void shouldShowInputPromptOnly() {
        assertEquals("<INPUT>(Enter A)", printer(false).show(builtin(Builtin.INPUT, string("Enter A"))));
    }

    @Test
    void shouldRefuseToSolveOverInput() {
        AtomicInteger requests = new AtomicInteger();
        Evaluator asking = new Evaluator(environment, prompt -> {
            requests.incrementAndGet();
            return CompletableFuture.completedFuture(Bit.ONE);
        }, NullLog.getInstance(), 100);
        ExpressionPrinter printer = new ExpressionPrinter(asking, minimizer, false);
        declare("ASK", List.of("X"), and(var("X"), builtin(Builtin.INPUT, string("y"))));

        assertThatThrownBy(() -> printer.show(builtin(Builtin.SOLVE_SOP, or(builtin(Builtin.INPUT, string("x")), var("A")))))
                .isInstanceOf(MiniLogicException.class)
                .hasMessage("SOLVE_SOP cannot sample INPUT while showing")
                .extracting("kind").isEqualTo(ErrorKind.UNSUPPORTED_OPERATION);
        assertThatThrownBy(() -> printer.show(builtin(Builtin.SOLVE_POS, call("ASK", var("A")))))
                .hasMessage("SOLVE_POS cannot sample INPUT while showing");
        assertEquals(0, requests.get());
        assertEquals("<TO_NOR>(<INPUT>(x)) = <INPUT>(x)",
                printer.show(builtin(Builtin.TO_NOR, builtin(Builtin.INPUT, string("x")))));
    }

    @Test
    void shouldPrintCallsWithoutInlining() {
        declare("F", List.of("X", "Y"), and(var("X"), not(var("Y"))));

        assertEquals("F(A, (B or 1))", printer(false).show(call("F", var("A"), or(var("B"), ONE))));
    }

    @Test
    void shouldInlineFunctionBodies() {
        declare("F", List.of("X", "Y"), and(var("X"), not(var("Y"))));
        declare("G", List.of("X"), or(call("F", var("X"), ONE), ref("K")));

        assertEquals("F(A, 1) = (A and not 1)", printer(true).show(call("F", var("A"), ONE)));
        assertEquals("G(B) = (F(B, 1) = (B and not 1) or K*)", printer(true).show(call("G", var("B"))));
    }

    @Test
    void shouldStopInliningRecursiveCalls() {
        declare("R", List.of("X"), or(call("R", var("X")), var("X")));

        assertEquals("R(A) = (R(A) or A)", printer(true).show(call("R", var("A"))));
    }

    @Test
    void shouldRejectStatementBuiltinsAndErrors() {
        assertThatThrownBy(() -> printer(false).show(builtin(Builtin.PRINT, ONE)))
                .isInstanceOf(MiniLogicException.class)
                .extracting("kind").isEqualTo(ErrorKind.UNSUPPORTED_OPERATION);
        assertThatThrownBy(() -> printer(false).show(new ErrorExpression("missing operand")))
                .isInstanceOf(MiniLogicException.class)
                .hasMessage("missing operand");
        assertThatThrownBy(() -> printer(true).show(call("MISSING")))
                .isInstanceOf(MiniLogicException.class)
                .hasMessageContaining("Function MISSING not defined");
    }
}
