package com.maxdemarzi.minilogic.ast;

public enum Bit {
    ZERO,
    ONE;

    public static Bit of(boolean value) {
        return value ? ONE : ZERO;
    }

    public static Bit of(char c) {
        switch (c) {
            case '0':
                return ZERO;
            case '1':
                return ONE;
            default:
                throw new IllegalArgumentException("Not a binary digit: " + c);
        }
    }

    public boolean isSet() {
        return this == ONE;
    }

    public Bit invert() {
        return this == ONE ? ZERO : ONE;
    }

    @Override
    public String toString() {
        return this == ONE ? "1" : "0";
    }
}
