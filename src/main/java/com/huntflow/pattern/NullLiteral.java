package com.huntflow.pattern;

/**
 * The NULL operand of {@code attr IS [NOT] NULL}
 */
public enum NullLiteral {
    INSTANCE;

    @Override
    public String toString() {
        return "NULL";
    }
}
