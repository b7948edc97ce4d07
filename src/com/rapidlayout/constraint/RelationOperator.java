package com.rapidlayout.constraint;

public enum RelationOperator {
    // listed in matching priority, two-character operators first
    LE("<="),
    GE(">="),
    LT("<"),
    GT(">"),
    EQ("=");

    private final String symbol;

    RelationOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isStrict() {
        return this == LT || this == GT;
    }

    public boolean evaluate(long lhs, long rhs) {
        switch (this) {
            case LE:
                return lhs <= rhs;
            case GE:
                return lhs >= rhs;
            case LT:
                return lhs < rhs;
            case GT:
                return lhs > rhs;
            default:
                return lhs == rhs;
        }
    }
}
