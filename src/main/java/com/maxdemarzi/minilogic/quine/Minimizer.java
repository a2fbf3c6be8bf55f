package com.maxdemarzi.minilogic.quine;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.maxdemarzi.minilogic.ast.Expression;
import com.maxdemarzi.minilogic.ast.Operator;
import com.maxdemarzi.minilogic.runtime.Evaluator;
import org.apache.commons.lang3.Validate;
import org.apache.commons.lang3.tuple.Triple;
import org.neo4j.logging.Log;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.maxdemarzi.minilogic.ast.Expressions.ONE;
import static com.maxdemarzi.minilogic.ast.Expressions.ZERO;
import static com.maxdemarzi.minilogic.ast.Expressions.reduce;

/**
 * Minimal two-level realization of a boolean function, found with the
 * Quine-McCluskey tabulation followed by Petrick's method.
 */
public class Minimizer {

    // Keyed by variables, the rows where the function is 1 (SOP) or 0 (POS), and the form
    public static final LoadingCache<Triple<List<String>, RoaringBitmap, Form>, List<Implicant>> coverCache = Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterAccess(60, TimeUnit.MINUTES)
            .build(Minimizer::findCover);

    private final Log log;

    public Minimizer(Log log) {
        this.log = log;
    }

    static List<Implicant> findCover(Triple<List<String>, RoaringBitmap, Form> key) {
        int numVars = key.getLeft().size();
        List<Implicant> primes = QuineMcCluskey.primeImplicants(numVars, key.getMiddle());
        return PetricksMethod.cover(primes, key.getMiddle());
    }

    /**
     * Minimal sum of products for the given minterms, each written as a bit string
     * over {@code variables} with the first variable first.
     */
    public Expression minimize(List<String> variables, Collection<String> minterms) {
        RoaringBitmap terms = new RoaringBitmap();
        for (String minterm : minterms) {
            Validate.isTrue(minterm.length() == variables.size(),
                    "Minterm %s does not have %d bits", minterm, variables.size());
            Validate.isTrue(minterm.matches("[01]*"), "Minterm %s is not binary", minterm);
            terms.add(minterm.isEmpty() ? 0 : Integer.parseInt(minterm, 2));
        }
        return minimize(variables, terms, Form.SOP);
    }

    /**
     * @param terms row numbers where the function is 1 for SOP, or where it is 0 for POS
     */
    public Expression minimize(List<String> variables, RoaringBitmap terms, Form form) {
        List<Implicant> cover = coverCache.get(Triple.of(List.copyOf(variables), terms.clone(), form));
        log.debug("Minimized %d terms over %d variables into %d implicants (%s)",
                terms.getCardinality(), variables.size(), cover.size(), form);

        List<Expression> parts = new ArrayList<>();
        for (Implicant implicant : cover) {
            parts.add(form == Form.SOP ? implicant.toProduct(variables) : implicant.toSum(variables));
        }
        return form == Form.SOP
                ? reduce(parts, Operator.OR, ZERO)
                : reduce(parts, Operator.AND, ONE);
    }

    // Samples the expression's truth table and minimizes it
    public Expression solve(Expression expression, Form form, Evaluator evaluator) {
        ExpressionedTruthTable table = new ExpressionedTruthTable(expression, evaluator).compute();
        log.debug("Sampled %d rows of %s", 1 << table.variables(), table.getExpression());
        RoaringBitmap terms = form == Form.SOP ? table.minTerms() : table.maxTerms();
        return minimize(table.getVariableNames(), terms, form);
    }
}
