package com.huntflow.datasource;

import com.huntflow.HuntflowException;

/**
 * Thrown when a data source cannot be resolved or read
 */
public class DataSourceException extends HuntflowException {

    private final String uri;

    public DataSourceException(String message, String uri) {
        super(message);
        this.uri = uri;
    }

    public DataSourceException(String message, String uri, Throwable cause) {
        super(message, cause);
        this.uri = uri;
    }

    public String getUri() {
        return uri;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " [Source: " + uri + "]";
    }
}
