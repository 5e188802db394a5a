package com.huntflow.statement;

import java.time.temporal.ChronoUnit;

/**
 * {@code BIN(attr, width[, unit])}: numeric buckets, or time buckets when a unit is given
 */
public class BinnedAttribute implements GroupingSpec {
    private final String attribute;
    private final long width;
    private final ChronoUnit unit;
    private final String alias;

    public BinnedAttribute(String attribute, long width, ChronoUnit unit, String alias) {
        this.attribute = attribute;
        this.width = width;
        this.unit = unit;
        this.alias = alias;
    }

    @Override
    public String getAttribute() {
        return attribute;
    }

    public long getWidth() {
        return width;
    }

    /**
     * Time unit of the bucket width, or null for numeric bins
     */
    public ChronoUnit getUnit() {
        return unit;
    }

    @Override
    public String getAlias() {
        return alias != null ? alias : attribute + "_bin";
    }

    @Override
    public String toString() {
        return "BIN(" + attribute + ", " + width + (unit != null ? ", " + unit : "") + ") AS " + getAlias();
    }
}
