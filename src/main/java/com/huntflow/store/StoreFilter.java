package com.huntflow.store;

import java.util.Map;

/**
 * Boolean filter compiled from a pattern, evaluated directly against store rows
 */
public interface StoreFilter {

    boolean test(Map<String, Object> row);

    /**
     * SQL-like rendering of the filter, for logging and diagnostics
     */
    String toSql();
}
