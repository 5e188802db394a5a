package com.huntflow.pattern;

import com.huntflow.HuntflowException;

/**
 * Malformed pattern: operator/value arity mismatch, a reference without values,
 * or a pattern rejected by the backend
 */
public class InvalidPatternException extends HuntflowException {

    private final String pattern;

    public InvalidPatternException(String message) {
        super(message);
        this.pattern = null;
    }

    public InvalidPatternException(String message, String pattern, Throwable cause) {
        super(message, cause);
        this.pattern = pattern;
    }

    /**
     * Offending pattern text, when known
     */
    public String getPattern() {
        return pattern;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (pattern != null) {
            sb.append(" [Pattern: ").append(pattern).append("]");
        }
        return sb.toString();
    }
}
