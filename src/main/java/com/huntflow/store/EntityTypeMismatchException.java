package com.huntflow.store;

import com.huntflow.HuntflowException;

/**
 * Thrown when result sets of different entity types are combined
 */
public class EntityTypeMismatchException extends HuntflowException {

    private final String expectedType;
    private final String actualType;

    public EntityTypeMismatchException(String expectedType, String actualType) {
        super("cannot combine entities of type " + actualType + " with " + expectedType);
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public String getExpectedType() {
        return expectedType;
    }

    public String getActualType() {
        return actualType;
    }
}
