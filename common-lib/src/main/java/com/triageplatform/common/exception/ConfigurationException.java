package com.triageplatform.common.exception;

/**
 * Invalid policy parameters (thresholds outside [0,1], non-positive weights, bad
 * retry settings). Always raised at construction time, never mid-round.
 */
public class ConfigurationException extends TriageException {

    public ConfigurationException(String component, String message) {
        super(component, message);
    }
}
