package com.triageplatform.common.confidence;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.triageplatform.common.exception.ValidationException;

/**
 * One piece of supporting evidence. Confidence must lie in [0,1] and weight must not be negative.
 */
public record EvidenceItem(
    @JsonProperty("source")      String source,
    @JsonProperty("confidence")  double confidence,
    @JsonProperty("weight")      double weight,
    @JsonProperty("description") String description
) {
    public EvidenceItem {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new ValidationException("EvidenceItem",
                "confidence must be within [0.0, 1.0], got " + confidence + " from " + source);
        }
        if (Double.isNaN(weight) || weight < 0.0) {
            throw new ValidationException("EvidenceItem",
                "weight must not be negative, got " + weight + " from " + source);
        }
        source      = source == null ? "unknown" : source;
        description = description == null ? "" : description;
    }

    public static EvidenceItem of(String source, double confidence, double weight) {
        return new EvidenceItem(source, confidence, weight, "");
    }
}
