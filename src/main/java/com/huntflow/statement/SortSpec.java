package com.huntflow.statement;

/**
 * Represents a sort attribute with order
 */
public class SortSpec {
    private final String attribute;
    private final boolean ascending;

    public SortSpec(String attribute, boolean ascending) {
        this.attribute = attribute;
        this.ascending = ascending;
    }

    public String getAttribute() {
        return attribute;
    }

    public boolean isAscending() {
        return ascending;
    }

    @Override
    public String toString() {
        return attribute + (ascending ? " ASC" : " DESC");
    }
}
