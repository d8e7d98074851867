package com.triageplatform.common.confidence;

public record ValidationOutcome(boolean valid, String reason) {

    public static ValidationOutcome ok() {
        return new ValidationOutcome(true, "confidence validated");
    }

    public static ValidationOutcome rejected(String reason) {
        return new ValidationOutcome(false, reason);
    }
}
