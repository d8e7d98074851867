package com.triageplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.triageplatform.common.exception.ValidationException;

import java.time.Instant;
import java.util.UUID;

/**
 * Operator verdict on a {@link DecisionRecord}. Annotation only: it never changes
 * the confidence or weighted score of the decision it refers to.
 */
public record HumanValidation(
    @JsonProperty("validationId") String validationId,
    @JsonProperty("decisionId")   String decisionId,
    @JsonProperty("approved")     boolean approved,
    @JsonProperty("validatedBy")  String validatedBy,
    @JsonProperty("feedback")     String feedback,
    @JsonProperty("validatedAt")  Instant validatedAt
) {
    public HumanValidation {
        if (decisionId == null || decisionId.isBlank()) {
            throw new ValidationException("HumanValidation", "decisionId is required");
        }
        if (validatedBy == null || validatedBy.isBlank()) {
            throw new ValidationException("HumanValidation", "validatedBy is required");
        }
    }

    public static HumanValidation of(String decisionId, boolean approved, String validatedBy,
                                     String feedback, Instant validatedAt) {
        return new HumanValidation("val-" + UUID.randomUUID(), decisionId, approved,
                                   validatedBy, feedback, validatedAt);
    }
}
