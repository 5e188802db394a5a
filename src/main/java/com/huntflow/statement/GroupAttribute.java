package com.huntflow.statement;

/**
 * Plain attribute grouping
 */
public class GroupAttribute implements GroupingSpec {
    private final String attribute;

    public GroupAttribute(String attribute) {
        this.attribute = attribute;
    }

    @Override
    public String getAttribute() {
        return attribute;
    }

    @Override
    public String getAlias() {
        return attribute;
    }

    @Override
    public String toString() {
        return attribute;
    }
}
