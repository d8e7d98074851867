package com.triageplatform.common.confidence;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Governed confidence for one reported score, produced by {@link ConfidencePolicy}.
 * {@code divergence = |reportedScore - finalScore|}.
 */
public record ConfidenceAssessment(
    @JsonProperty("finalScore")           double finalScore,
    @JsonProperty("reportedScore")        double reportedScore,
    @JsonProperty("evidenceCount")        int evidenceCount,
    @JsonProperty("evidenceWeightSum")    double evidenceWeightSum,
    @JsonProperty("confidenceLevel")      ConfidenceLevel confidenceLevel,
    @JsonProperty("anomalyFlag")          AnomalyFlag anomalyFlag,
    @JsonProperty("divergence")           double divergence,
    @JsonProperty("divergencePercentage") double divergencePercentage,
    @JsonProperty("details")              Map<String, Object> details,
    @JsonProperty("calculatedAt")         Instant calculatedAt
) {
    public ConfidenceAssessment {
        details      = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        calculatedAt = calculatedAt == null ? Instant.now() : calculatedAt;
    }

    /** Placeholder for a batch item that could not be calculated. */
    public static ConfidenceAssessment failed(double reportedScore, String error, Instant at) {
        return new ConfidenceAssessment(0.0, reportedScore, 0, 0.0, ConfidenceLevel.VERY_LOW,
            AnomalyFlag.CONFIRMED, 1.0, 100.0, Map.of("error", String.valueOf(error)), at);
    }

    public boolean hasAnomaly() {
        return anomalyFlag != AnomalyFlag.NONE;
    }
}
