package com.huntflow.pattern;

import java.util.Arrays;
import java.util.Locale;

/**
 * Comparison operators of the pattern language
 */
public enum Operator {
    EQUAL("="),
    NOT_EQUAL("!="),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">="),
    LIKE("LIKE"),
    MATCHES("MATCHES"),
    IN("IN"),
    NOT_IN("NOT IN"),
    ISSUBSET("ISSUBSET"),
    NOT_ISSUBSET("NOT ISSUBSET");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * IN and NOT IN take a list; every other operator takes a scalar
     */
    public boolean isListOperator() {
        return this == IN || this == NOT_IN;
    }

    /**
     * Operator to use once a scalar operand turned into several values
     */
    public Operator widen() {
        switch (this) {
            case EQUAL:
                return IN;
            case NOT_EQUAL:
                return NOT_IN;
            default:
                return this;
        }
    }

    /**
     * Look up an operator by its source spelling; whitespace and case are ignored
     */
    public static Operator fromSymbol(String text) {
        String normalized = String.join(" ", text.trim().split("\\s+")).toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(op -> op.symbol.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidPatternException("unknown operator \"" + text + "\""));
    }

    @Override
    public String toString() {
        return symbol;
    }
}
