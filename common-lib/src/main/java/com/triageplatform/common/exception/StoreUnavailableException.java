package com.triageplatform.common.exception;

/**
 * A backing store (dedup cache, checkpoint database) could not be reached or
 * rejected the operation for infrastructure reasons. Recoverable by retry or
 * graceful degradation.
 */
public class StoreUnavailableException extends TriageException {

    public StoreUnavailableException(String component, String message) {
        super(component, message);
    }

    public StoreUnavailableException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
