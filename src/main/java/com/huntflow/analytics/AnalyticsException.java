package com.huntflow.analytics;

import com.huntflow.HuntflowException;

/**
 * Thrown when an analytics URI cannot be resolved or the analytics fails
 */
public class AnalyticsException extends HuntflowException {

    private final String uri;

    public AnalyticsException(String message, String uri) {
        super(message);
        this.uri = uri;
    }

    public AnalyticsException(String message, String uri, Throwable cause) {
        super(message, cause);
        this.uri = uri;
    }

    public String getUri() {
        return uri;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " [Analytics: " + uri + "]";
    }
}
