package com.triageplatform.common.exception;

/**
 * Root of the triage exception hierarchy. Carries the component that raised it
 * so log lines and error signals can be attributed without parsing messages.
 */
public class TriageException extends RuntimeException {
    private final String component;

    public TriageException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public TriageException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
