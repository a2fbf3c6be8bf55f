package com.maxdemarzi.minilogic.compile;

import com.maxdemarzi.minilogic.ast.*;
import com.maxdemarzi.minilogic.runtime.ErrorKind;
import com.maxdemarzi.minilogic.runtime.MiniLogicException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.maxdemarzi.minilogic.ast.Expressions.*;

/**
 * Expands a function table into an algebraic function. Every row becomes
 * the conjunction of its pattern literals and its output expression, and
 * the rows are OR-ed together. Subparameters are appended to the formal
 * parameters so row outputs can use them.
 */
public final class FunctionTableCompiler {

    private FunctionTableCompiler() {
    }

    public static FunctionDeclaration compile(FunctionTableDeclaration table) {
        List<String> formals = new ArrayList<>(table.getParameters());
        formals.addAll(table.getSubparameters());

        List<Expression> minterms = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (TableRow row : table.getRows()) {
            // Row bits index the parameters, subparameters only appear in outputs
            if (row.width() != table.getParameters().size()) {
                throw new MiniLogicException(ErrorKind.GRAMMAR_CONTRACT,
                        "Row " + row.getPattern() + " of " + table.getName() + " has " + row.width()
                                + " bits, expected " + table.getParameters().size(), table);
            }
            if (!seen.add(row.getPattern())) {
                throw new MiniLogicException(ErrorKind.GRAMMAR_CONTRACT,
                        "Duplicate row " + row.getPattern() + " in function table " + table.getName(), table);
            }

            List<Expression> terms = new ArrayList<>();
            for (int i = 0; i < row.width(); i++) {
                Variable parameter = var(formals.get(i));
                terms.add(row.bitAt(i).isSet() ? parameter : not(parameter));
            }
            terms.add(row.getValue());
            minterms.add(reduce(terms, Operator.AND, ONE));
        }

        Expression body = reduce(minterms, Operator.OR, ZERO);
        return new FunctionDeclaration(table.getName(), formals, body, table.getRange());
    }
}
