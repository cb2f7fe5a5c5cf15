package com.spreadsheet.calc.engine.parser;

public enum BinaryOperator {
    ADD("+", false),
    SUBTRACT("-", false),
    MULTIPLY("*", false),
    DIVIDE("/", false),
    EQUAL("=", true),
    NOT_EQUAL("<>", true),
    LESS("<", true),
    LESS_EQUAL("<=", true),
    GREATER(">", true),
    GREATER_EQUAL(">=", true);

    private final String symbol;
    private final boolean comparison;

    BinaryOperator(String symbol, boolean comparison) {
        this.symbol = symbol;
        this.comparison = comparison;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isComparison() {
        return comparison;
    }
}
