package com.triageplatform.common.consensus;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable output of a {@link ConsensusEngine} run.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code aggregateScore}: Σ(confidence·weight) / Σ(weight), in [0.0, 1.0]</li>
 *   <li>{@code consensusKind}: qualitative agreement classification</li>
 *   <li>{@code perAgentWeightedScore}: agentId → confidence·weight</li>
 *   <li>{@code agentVotes}: agentId → raw reported confidence</li>
 *   <li>{@code anomalyNote}: set when any opinion diverges more than 0.2 from the aggregate</li>
 *   <li>{@code dominantLabel}: most common (normalised) label, weight-resolved on count ties</li>
 * </ul>
 *
 * <p>Anomalies are decision signals carried here, never thrown.
 */
public record ConsensusOutcome(
    @JsonProperty("aggregateScore")        double aggregateScore,
    @JsonProperty("consensusKind")         ConsensusKind consensusKind,
    @JsonProperty("perAgentWeightedScore") Map<String, Double> perAgentWeightedScore,
    @JsonProperty("agentVotes")            Map<String, Double> agentVotes,
    @JsonProperty("requiresHumanReview")   boolean requiresHumanReview,
    @JsonProperty("anomalyNote")           String anomalyNote,
    @JsonProperty("divergentAgentIds")     List<String> divergentAgentIds,
    @JsonProperty("dominantLabel")         String dominantLabel,
    @JsonProperty("agreementRatio")        double agreementRatio,
    @JsonProperty("strategyName")          String strategyName,
    @JsonProperty("calculatedAt")          Instant calculatedAt
) {
    public ConsensusOutcome {
        perAgentWeightedScore = perAgentWeightedScore == null ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(perAgentWeightedScore));
        agentVotes = agentVotes == null ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(agentVotes));
        divergentAgentIds = divergentAgentIds == null ? List.of() : List.copyOf(divergentAgentIds);
        calculatedAt = calculatedAt == null ? Instant.now() : calculatedAt;
    }

    /** Safe default for an empty or degenerate opinion set: score 0, review required. */
    public static ConsensusOutcome empty(String strategyName) {
        return new ConsensusOutcome(0.0, ConsensusKind.EMPTY, Map.of(), Map.of(), true,
                                    null, List.of(), null, 0.0, strategyName, Instant.now());
    }

    public boolean hasAnomaly() {
        return anomalyNote != null;
    }
}
