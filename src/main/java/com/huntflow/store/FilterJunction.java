package com.huntflow.store;

import java.util.Map;

/**
 * AND / OR of two filters
 */
public class FilterJunction implements StoreFilter {
    private final String operator;
    private final StoreFilter left;
    private final StoreFilter right;

    public FilterJunction(String operator, StoreFilter left, StoreFilter right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public String getOperator() {
        return operator;
    }

    public StoreFilter getLeft() {
        return left;
    }

    public StoreFilter getRight() {
        return right;
    }

    @Override
    public boolean test(Map<String, Object> row) {
        if ("AND".equals(operator)) {
            return left.test(row) && right.test(row);
        }
        return left.test(row) || right.test(row);
    }

    @Override
    public String toSql() {
        return "(" + left.toSql() + " " + operator + " " + right.toSql() + ")";
    }

    @Override
    public String toString() {
        return toSql();
    }
}
