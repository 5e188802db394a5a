package com.huntflow;

/**
 * Signals a defect inside the runtime rather than a user error,
 * e.g. an empty field left behind by the parser or a pattern bound twice.
 */
public class InternalInvariantException extends HuntflowException {

    public InternalInvariantException(String message) {
        super(message);
    }
}
