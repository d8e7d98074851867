package com.triageplatform.common.exception;

/**
 * Raised when a checkpoint step index does not strictly increase for its thread.
 */
public class StepOrderingException extends ValidationException {
    private final String threadId;
    private final int stepIndex;
    private final int latestStepIndex;

    public StepOrderingException(String threadId, int stepIndex, int latestStepIndex) {
        super("CheckpointEngine", String.format(
            "stepIndex=%d must be greater than latest=%d for thread=%s",
            stepIndex, latestStepIndex, threadId));
        this.threadId        = threadId;
        this.stepIndex       = stepIndex;
        this.latestStepIndex = latestStepIndex;
    }

    public String getThreadId() {
        return threadId;
    }

    public int getStepIndex() {
        return stepIndex;
    }

    public int getLatestStepIndex() {
        return latestStepIndex;
    }
}
