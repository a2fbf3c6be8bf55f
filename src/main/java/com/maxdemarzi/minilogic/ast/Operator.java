package com.maxdemarzi.minilogic.ast;

import java.util.function.BinaryOperator;

/**
 * Logical operators of the language. NOT is the only unary one,
 * every other operator is binary and carries its truth table.
 */
public enum Operator {
    NOT("not", null),
    AND("and", (a, b) -> Bit.of(a.isSet() & b.isSet())),
    OR("or", (a, b) -> Bit.of(a.isSet() | b.isSet())),
    XOR("xor", (a, b) -> Bit.of(a.isSet() ^ b.isSet())),
    NAND("nand", (a, b) -> Bit.of(!(a.isSet() & b.isSet()))),
    NOR("nor", (a, b) -> Bit.of(!(a.isSet() | b.isSet()))),
    XNOR("xnor", (a, b) -> Bit.of(!(a.isSet() ^ b.isSet()))),
    IMPLY("imply", (a, b) -> Bit.of(!a.isSet() | b.isSet())),
    NIMPLY("nimply", (a, b) -> Bit.of(a.isSet() & !b.isSet()));

    private final String keyword;
    private final BinaryOperator<Bit> table;

    Operator(String keyword, BinaryOperator<Bit> table) {
        this.keyword = keyword;
        this.table = table;
    }

    public String getKeyword() {
        return keyword;
    }

    public boolean isUnary() {
        return table == null;
    }

    public Bit apply(Bit operand) {
        if (!isUnary()) {
            throw new UnsupportedOperationException(keyword + " is not a unary operator");
        }
        return operand.invert();
    }

    public Bit apply(Bit left, Bit right) {
        if (isUnary()) {
            throw new UnsupportedOperationException(keyword + " is not a binary operator");
        }
        return table.apply(left, right);
    }

    @Override
    public String toString() {
        return keyword;
    }
}
