package com.huntflow.store;

import com.huntflow.HuntflowException;

/**
 * A filter or wire pattern the backend cannot evaluate
 */
public class StorePatternException extends HuntflowException {

    private final String pattern;

    public StorePatternException(String message, String pattern) {
        super(message);
        this.pattern = pattern;
    }

    public StorePatternException(String message, String pattern, Throwable cause) {
        super(message, cause);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
