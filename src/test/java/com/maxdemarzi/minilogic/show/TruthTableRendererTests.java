package com.maxdemarzi.minilogic.show;

import com.maxdemarzi.minilogic.ast.Expression;
import com.maxdemarzi.minilogic.quine.ExpressionedTruthTable;
import com.maxdemarzi.minilogic.runtime.Environment;
import com.maxdemarzi.minilogic.runtime.Evaluator;
import com.maxdemarzi.minilogic.runtime.InputSource;
import org.junit.jupiter.api.Test;
import org.neo4j.logging.NullLog;

import static com.maxdemarzi.minilogic.ast.Expressions.*;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class TruthTableRendererTests {

    private final Evaluator evaluator = new Evaluator(new Environment(), InputSource.NONE, NullLog.getInstance(), 100);

    private String render(Expression expression, String title) {
        return TruthTableRenderer.render(new ExpressionedTruthTable(expression, evaluator), title);
    }

    @Test
    void shouldRenderRowsInBinaryOrder() {
        String expected = String.join("\n",
                "| A B | (A and B) |",
                "| --- | --------- |",
                "| 00  | 0         |",
                "| 01  | 0         |",
                "| 10  | 0         |",
                "| 11  | 1         |");

        assertEquals(expected, render(and(var("A"), var("B")), "(A and B)"));
    }

    @Test
    void shouldOrderVariablesByFirstAppearance() {
        String expected = String.join("\n",
                "| B A | x |",
                "| --- | - |",
                "| 00  | 1 |",
                "| 01  | 1 |",
                "| 10  | 0 |",
                "| 11  | 1 |");

        // B imply A, with B in the first column
        assertEquals(expected, render(or(not(var("B")), var("A")), "x"));
    }

    @Test
    void shouldWidenColumnsForLongInputs() {
        String rendered = render(or(or(var("LONG"), var("B")), var("C")), "o");

        String[] lines = rendered.split("\n");
        assertEquals(10, lines.length);
        assertEquals("| LONG B C | o |", lines[0]);
        assertEquals("| -------- | - |", lines[1]);
        assertEquals("| 000      | 0 |", lines[2]);
        assertEquals("| 111      | 1 |", lines[9]);
    }

    @Test
    void shouldRenderConstantWithSingleRow() {
        String expected = String.join("\n",
                "|   | 1 |",
                "| - | - |",
                "|   | 1 |");

        assertEquals(expected, render(ONE, "1"));
    }
}
