package com.huntflow.semantics;

import com.huntflow.HuntflowException;

/**
 * Thrown when GET omits FROM and no data source has been queried yet
 */
public class SourceResolutionException extends HuntflowException {

    public SourceResolutionException(String message) {
        super(message);
    }
}
