package com.huntflow.statement;

/**
 * Represents an aggregation function applied to one attribute
 */
public class Aggregation {
    private final AggregationFunction function;
    private final String attribute;
    private final String alias;

    public Aggregation(AggregationFunction function, String attribute, String alias) {
        this.function = function;
        this.attribute = attribute;
        this.alias = alias;
    }

    public AggregationFunction getFunction() {
        return function;
    }

    public String getAttribute() {
        return attribute;
    }

    public String getAlias() {
        return alias != null ? alias : function.keyword() + "_" + attribute;
    }

    @Override
    public String toString() {
        return function.keyword() + "(" + attribute + ") AS " + getAlias();
    }
}
