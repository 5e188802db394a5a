package com.huntflow.statement;

/**
 * One element of a GROUP BY list
 */
public interface GroupingSpec {

    /**
     * Attribute the grouping reads from
     */
    String getAttribute();

    /**
     * Column name the grouping produces
     */
    String getAlias();
}
