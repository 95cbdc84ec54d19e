package com.example.tenantstore.query;

public enum Operator {
    EQ("="),
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<="),
    CONTAINS("CONTAINS"),
    ARRAY_CONTAINS("ARRAY_CONTAINS"),
    /** Matches when the field is absent or anything other than {@code true}. Internal use only. */
    NOT_TRUE("NOT_TRUE");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isRange() {
        return this == GT || this == GTE || this == LT || this == LTE;
    }
}
