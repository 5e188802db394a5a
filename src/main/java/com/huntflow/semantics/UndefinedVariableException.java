package com.huntflow.semantics;

import com.huntflow.HuntflowException;

/**
 * Thrown when a statement reads a variable that was never bound
 */
public class UndefinedVariableException extends HuntflowException {

    private final String variable;

    public UndefinedVariableException(String variable) {
        super("variable \"" + variable + "\" does not exist");
        this.variable = variable;
    }

    public String getVariable() {
        return variable;
    }
}
