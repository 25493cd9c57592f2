package com.ymcmp.arkade.ast;

public enum BinaryOperator {
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    EQ("=="),
    NE("!="),
    GE(">="),
    GT(">"),
    LE("<="),
    LT("<");

    public final String symbol;

    private BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public boolean isArithmetic() {
        switch (this) {
            case ADD:
            case SUB:
            case MUL:
            case DIV:
                return true;
            default:
                return false;
        }
    }

    public boolean isComparison() {
        return !isArithmetic();
    }

    public static BinaryOperator fromSymbol(final String symbol) {
        for (final BinaryOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown operator " + symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
