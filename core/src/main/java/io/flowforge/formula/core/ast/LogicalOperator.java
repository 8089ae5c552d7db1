package io.flowforge.formula.core.ast;

/** Short-circuit operators. */
public enum LogicalOperator {
    AND("&&"),
    OR("||");

    private final String symbol;

    LogicalOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
