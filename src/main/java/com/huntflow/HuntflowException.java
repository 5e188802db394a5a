package com.huntflow;

/**
 * Base class of every error raised by the huntflow runtime
 */
public class HuntflowException extends RuntimeException {

    public HuntflowException(String message) {
        super(message);
    }

    public HuntflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
