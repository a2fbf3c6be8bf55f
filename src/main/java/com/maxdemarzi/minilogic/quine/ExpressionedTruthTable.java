package com.maxdemarzi.minilogic.quine;

import com.maxdemarzi.minilogic.ast.*;
import com.maxdemarzi.minilogic.results.TruthTableRow;
import com.maxdemarzi.minilogic.runtime.Evaluator;
import com.maxdemarzi.minilogic.runtime.LocalScope;
import org.apache.commons.lang3.Validate;
import org.eclipse.collections.api.bimap.BiMap;
import org.eclipse.collections.api.bimap.MutableBiMap;
import org.eclipse.collections.impl.bimap.mutable.HashBiMap;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.List;

/**
 * The truth table of an expression over its free variables. Variables are the
 * non-reference names in order of first appearance, and the first one is the most
 * significant bit of the row number.
 */
public class ExpressionedTruthTable {
    public static final int MAX_VARIABLES = 20;

    private final Expression expression;
    private final Evaluator evaluator;
    private final MutableBiMap<String, Integer> varMapping = new HashBiMap<>();
    private final int numVariables;
    private final int numRows;
    private final List<TruthTableRow> rows;

    public ExpressionedTruthTable(Expression expression, Evaluator evaluator) {
        this.expression = expression;
        this.evaluator = evaluator;
        collectVariables(expression);

        numVariables = varMapping.size();
        Validate.isTrue(numVariables <= MAX_VARIABLES,
                "Truth table over %d variables is too large, at most %d are supported", numVariables, MAX_VARIABLES);
        numRows = 1 << numVariables;
        rows = new ArrayList<>(numRows);
    }

    public ExpressionedTruthTable compute() {
        rows.clear();
        List<String> names = getVariableNames();
        for (int i = 0; i < numRows; i++) {
            LocalScope scope = new LocalScope();
            StringBuilder inputs = new StringBuilder(numVariables);
            for (int j = 0; j < numVariables; j++) {
                Bit bit = Bit.of(((i >> (numVariables - 1 - j)) & 1) == 1);
                scope.bind(names.get(j), bit);
                inputs.append(bit);
            }
            rows.add(new TruthTableRow(inputs.toString(), evaluator.evaluate(expression, scope.asMap())));
        }
        return this;
    }

    public RoaringBitmap minTerms() {
        return termsWith(Bit.ONE);
    }

    public RoaringBitmap maxTerms() {
        return termsWith(Bit.ZERO);
    }

    private RoaringBitmap termsWith(Bit output) {
        if (rows.size() != numRows) {
            compute();
        }
        RoaringBitmap terms = new RoaringBitmap();
        for (int i = 0; i < numRows; i++) {
            if (rows.get(i).output == output) {
                terms.add(i);
            }
        }
        return terms;
    }

    public List<TruthTableRow> getRows() {
        if (rows.size() != numRows) {
            compute();
        }
        return rows;
    }

    public Expression getExpression() {
        return expression;
    }

    public int variables() {
        return numVariables;
    }

    public BiMap<Integer, String> getMapping() {
        return varMapping.inverse();
    }

    public List<String> getVariableNames() {
        BiMap<Integer, String> mapping = getMapping();
        List<String> names = new ArrayList<>(numVariables);
        for (int i = 0; i < varMapping.size(); i++) {
            names.add(mapping.get(i));
        }
        return names;
    }

    private void collectVariables(Expression root) {
        root.accept(new ExpressionVisitor<Void>() {
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
                // References come from the globals, they are not inputs of the table
                if (!variable.isReference() && !varMapping.containsKey(variable.getName())) {
                    varMapping.put(variable.getName(), varMapping.size());
                }
                return null;
            }

            @Override
            public Void visitBinary(BinaryOperation binary) {
                binary.getLeft().accept(this);
                binary.getRight().accept(this);
                return null;
            }

            @Override
            public Void visitUnary(UnaryOperation unary) {
                return unary.getOperand().accept(this);
            }

            @Override
            public Void visitFunctionCall(FunctionCall call) {
                call.getArguments().forEach(argument -> argument.accept(this));
                return null;
            }

            @Override
            public Void visitBuiltinCall(BuiltinCall call) {
                call.getParameters().forEach(parameter -> parameter.accept(this));
                return null;
            }

            @Override
            public Void visitError(ErrorExpression error) {
                return null;
            }
        });
    }
}
