package com.triageplatform.common.confidence;

import com.triageplatform.common.exception.ConfigurationException;
import com.triageplatform.common.exception.TriageException;
import com.triageplatform.common.exception.ValidationException;
import com.triageplatform.common.model.DecisionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Blends a reported confidence with supporting evidence into a governed score.
 *
 * <pre>
 *   evidenceAverage      = Σ(e.confidence × e.weight) / Σ(e.weight)
 *   evidenceContribution = evidenceAverage × 0.1
 *   finalScore           = min(1.0, agentConfidence × baseWeight + evidenceContribution)
 *   divergence           = |agentConfidence − finalScore|
 * </pre>
 *
 * No evidence, or a zero weight sum, leaves {@code finalScore = agentConfidence}.
 * Stateless and thread-safe.
 */
public class ConfidencePolicy {

    private static final Logger log = LoggerFactory.getLogger(ConfidencePolicy.class);

    public static final double EVIDENCE_WEIGHT_FACTOR = 0.1;
    public static final double DEFAULT_BASE_WEIGHT    = 1.0;

    private static final int FEW_EVIDENCE = 3;

    private final double baseWeight;
    private final Clock clock;

    public ConfidencePolicy() {
        this(DEFAULT_BASE_WEIGHT);
    }

    public ConfidencePolicy(double baseWeight) {
        this(baseWeight, Clock.systemUTC());
    }

    public ConfidencePolicy(double baseWeight, Clock clock) {
        if (Double.isNaN(baseWeight) || Double.isInfinite(baseWeight) || baseWeight <= 0.0) {
            throw new ConfigurationException("ConfidencePolicy", "baseWeight must be positive, got " + baseWeight);
        }
        this.baseWeight = baseWeight;
        this.clock = clock;
    }

    public double baseWeight() {
        return baseWeight;
    }

    /**
     * @throws ValidationException when {@code agentConfidence} is outside [0,1]
     */
    public ConfidenceAssessment calculate(double agentConfidence, List<EvidenceItem> evidence,
                                          DecisionContext context) {
        if (Double.isNaN(agentConfidence) || agentConfidence < 0.0 || agentConfidence > 1.0) {
            throw new ValidationException("ConfidencePolicy",
                "agentConfidence must be within [0.0, 1.0], got " + agentConfidence);
        }
        List<EvidenceItem> items = evidence == null ? List.of() : evidence;

        double weightSum = 0.0;
        double weightedSum = 0.0;
        List<String> sources = new ArrayList<>(items.size());
        for (EvidenceItem item : items) {
            weightSum   += item.weight();
            weightedSum += item.confidence() * item.weight();
            sources.add(item.source());
        }

        double evidenceAverage = 0.0;
        double contribution = 0.0;
        double finalScore;
        if (items.isEmpty() || weightSum <= 0.0) {
            finalScore = agentConfidence;
        } else {
            evidenceAverage = weightedSum / weightSum;
            contribution    = evidenceAverage * EVIDENCE_WEIGHT_FACTOR;
            finalScore      = Math.min(1.0, agentConfidence * baseWeight + contribution);
        }
        finalScore = Math.max(0.0, finalScore);

        double divergence = Math.abs(agentConfidence - finalScore);
        AnomalyFlag flag = AnomalyFlag.forDivergence(divergence);
        ConfidenceLevel level = ConfidenceLevel.of(finalScore);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("agentConfidence", agentConfidence);
        details.put("evidenceAverage", evidenceAverage);
        details.put("evidenceContribution", contribution);
        details.put("baseWeight", baseWeight);
        details.put("evidenceSources", sources);
        if (context != null && context.threadId() != null) {
            details.put("threadId", context.threadId());
        }

        if (flag != AnomalyFlag.NONE) {
            log.warn("[Confidence] divergence={}% flag={} reported={} final={}",
                String.format("%.1f", divergence * 100.0), flag.wireName(),
                String.format("%.3f", agentConfidence), String.format("%.3f", finalScore));
        } else {
            log.debug("[Confidence] final={} reported={} level={} evidence={}",
                String.format("%.3f", finalScore), String.format("%.3f", agentConfidence),
                level.wireName(), items.size());
        }

        return new ConfidenceAssessment(finalScore, agentConfidence, items.size(), weightSum, level,
            flag, divergence, divergence * 100.0, details, clock.instant());
    }

    public ConfidenceAssessment calculate(double agentConfidence, List<EvidenceItem> evidence) {
        return calculate(agentConfidence, evidence, null);
    }

    /**
     * Rejects a likely anomaly, and a low confidence (&lt; 0.5) with no evidence behind it.
     */
    public ValidationOutcome validate(double agentConfidence, List<EvidenceItem> evidence,
                                      DecisionContext context) {
        ConfidenceAssessment assessment = calculate(agentConfidence, evidence, context);
        if (assessment.anomalyFlag() == AnomalyFlag.LIKELY) {
            return ValidationOutcome.rejected(String.format(
                "likely anomaly: divergence of %.1f%% between reported (%.3f) and calculated (%.3f)",
                assessment.divergencePercentage(), agentConfidence, assessment.finalScore()));
        }
        if (assessment.evidenceCount() == 0 && agentConfidence < 0.5) {
            return ValidationOutcome.rejected("low confidence without supporting evidence");
        }
        return ValidationOutcome.ok();
    }

    /** Plain-text operator hint; hints are joined with {@code " | "}. */
    public String recommendation(ConfidenceAssessment assessment) {
        List<String> hints = new ArrayList<>();
        switch (assessment.confidenceLevel()) {
            case VERY_LOW  -> hints.add("VERY LOW CONFIDENCE: urgent human review required");
            case LOW       -> hints.add("LOW CONFIDENCE: human review recommended");
            case VERY_HIGH -> hints.add("VERY HIGH CONFIDENCE: may proceed automatically");
            default -> { }
        }
        switch (assessment.anomalyFlag()) {
            case LIKELY, CONFIRMED -> hints.add(String.format(
                "LIKELY ANOMALY: divergence of %.1f%% between reported and calculated",
                assessment.divergencePercentage()));
            case POTENTIAL -> hints.add(String.format(
                "POTENTIAL ANOMALY: divergence of %.1f%% (near threshold)", assessment.divergencePercentage()));
            default -> { }
        }
        if (assessment.evidenceCount() == 0) {
            hints.add("No supporting evidence: confidence rests on the agent alone");
        } else if (assessment.evidenceCount() < FEW_EVIDENCE) {
            hints.add("Little evidence (" + assessment.evidenceCount() + "): consider collecting more data");
        }
        return hints.isEmpty() ? "No special recommendations" : String.join(" | ", hints);
    }

    /**
     * Calculates every request independently. A request that fails yields
     * {@link ConfidenceAssessment#failed} in its slot instead of aborting the batch.
     */
    public List<ConfidenceAssessment> batchCalculate(List<ConfidenceRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }
        List<ConfidenceAssessment> results = new ArrayList<>(requests.size());
        for (ConfidenceRequest request : requests) {
            try {
                results.add(calculate(request.agentConfidence(), request.evidence(), request.context()));
            } catch (TriageException e) {
                log.error("[Confidence] batch item failed. reported={} error={}",
                    request.agentConfidence(), e.getMessage());
                results.add(ConfidenceAssessment.failed(request.agentConfidence(), e.getMessage(), clock.instant()));
            }
        }
        return results;
    }
}
