package com.huntflow.semantics;

import com.huntflow.HuntflowException;

/**
 * Thrown when an attribute is qualified with a type other than its variable's
 */
public class InvalidAttributeException extends HuntflowException {

    private final String attribute;

    public InvalidAttributeException(String attribute, String entityType) {
        super("invalid attribute \"" + attribute + "\" for entities of type " + entityType);
        this.attribute = attribute;
    }

    public String getAttribute() {
        return attribute;
    }
}
