package com.triageplatform.common.exception;

/**
 * Malformed or unsafe input. A round that receives one is aborted as a whole;
 * the offending value is never dropped silently.
 */
public class ValidationException extends TriageException {

    public ValidationException(String component, String message) {
        super(component, message);
    }
}
