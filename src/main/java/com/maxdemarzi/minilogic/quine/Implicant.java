package com.maxdemarzi.minilogic.quine;

import com.maxdemarzi.minilogic.ast.Expression;
import com.maxdemarzi.minilogic.ast.Operator;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.List;

import static com.maxdemarzi.minilogic.ast.Expressions.*;

/**
 * A product term over a fixed number of variables. Variable 0 is the most significant bit,
 * so a minterm's value is also its row number in the truth table. Positions set in
 * {@code dontCares} have been merged away and carry no literal.
 */
public class Implicant implements Comparable<Implicant> {

    private final long bits;
    private final long dontCares;
    private final int numVars;
    private final RoaringBitmap minterms;

    public Implicant(long bits, long dontCares, int numVars, RoaringBitmap minterms) {
        this.bits = bits & ~dontCares;
        this.dontCares = dontCares;
        this.numVars = numVars;
        this.minterms = minterms;
    }

    public Implicant(int minterm, int numVars) {
        this(minterm, 0L, numVars, RoaringBitmap.bitmapOf(minterm));
    }

    public int getNumVars() {
        return numVars;
    }

    // Implicants live in the shared cover cache, so callers get a copy
    public RoaringBitmap getMinterms() {
        return minterms.clone();
    }

    public int ones() {
        return Long.bitCount(bits);
    }

    public int literalCount() {
        return numVars - Long.bitCount(dontCares);
    }

    public boolean covers(int minterm) {
        return minterms.contains(minterm);
    }

    // Merge with a term that has the same don't-cares and differs in exactly one bit, or null
    public Implicant merge(Implicant other) {
        if (other.dontCares != dontCares || other.numVars != numVars) {
            return null;
        }
        long difference = bits ^ other.bits;
        if (Long.bitCount(difference) != 1) {
            return null;
        }
        return new Implicant(bits, dontCares | difference, numVars, RoaringBitmap.or(minterms, other.minterms));
    }

    public String getPattern() {
        StringBuilder pattern = new StringBuilder(numVars);
        for (int i = 0; i < numVars; i++) {
            long position = 1L << (numVars - 1 - i);
            if ((dontCares & position) != 0) {
                pattern.append('-');
            } else {
                pattern.append((bits & position) != 0 ? '1' : '0');
            }
        }
        return pattern.toString();
    }

    // AND of the cared-for literals, e.g. 1-0 over A, B, C is A and not C
    public Expression toProduct(List<String> variables) {
        List<Expression> terms = new ArrayList<>();
        String pattern = getPattern();
        for (int i = 0; i < numVars; i++) {
            char c = pattern.charAt(i);
            if (c == '1') {
                terms.add(var(variables.get(i)));
            } else if (c == '0') {
                terms.add(not(var(variables.get(i))));
            }
        }
        return reduce(terms, Operator.AND, ONE);
    }

    // OR clause that is false exactly on this implicant's rows, e.g. 1-0 over A, B, C is not A or C
    public Expression toSum(List<String> variables) {
        List<Expression> terms = new ArrayList<>();
        String pattern = getPattern();
        for (int i = 0; i < numVars; i++) {
            char c = pattern.charAt(i);
            if (c == '0') {
                terms.add(var(variables.get(i)));
            } else if (c == '1') {
                terms.add(not(var(variables.get(i))));
            }
        }
        return reduce(terms, Operator.OR, ZERO);
    }

    @Override
    public int compareTo(Implicant other) {
        return getPattern().compareTo(other.getPattern());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Implicant)) return false;
        Implicant other = (Implicant) o;
        return bits == other.bits && dontCares == other.dontCares && numVars == other.numVars;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(bits) * 31 * 31 + Long.hashCode(dontCares) * 31 + numVars;
    }

    @Override
    public String toString() {
        return getPattern() + " " + minterms;
    }
}
