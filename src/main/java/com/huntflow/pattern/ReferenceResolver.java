package com.huntflow.pattern;

import com.huntflow.statement.TimeRange;

import java.util.List;
import java.util.Optional;

/**
 * Looks up the materialized values behind references
 */
public interface ReferenceResolver {

    /**
     * Distinct values of the referenced attribute, in first-seen order
     */
    List<Object> values(Reference reference);

    /**
     * Observation window of a variable, if its rows carry timestamps
     */
    Optional<TimeRange> timeBounds(String variable);
}
