package com.triageplatform.common.consensus;

import com.triageplatform.common.exception.ConfigurationException;
import com.triageplatform.common.model.AgentOpinion;
import com.triageplatform.common.model.DecisionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default {@link ConsensusEngine}: role-weighted average of reported confidences.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Weight each opinion by its role ({@link com.triageplatform.common.model.AgentRole#weightIn}).</li>
 *   <li>{@code aggregateScore = Σ(confidence × weight) / Σ(weight)}, clamped to [0.0, 1.0].</li>
 *   <li>Classify agreement on normalised labels, where the agreement ratio is the share of
 *       total weight behind the heaviest label: one opinion → SINGLE_AGENT; one label → UNANIMOUS;
 *       ratio ≥ 0.75 → STRONG_MAJORITY; ratio ≥ 0.5 → MAJORITY; otherwise SPLIT.</li>
 *   <li>Flag every opinion with {@code |confidence − aggregateScore| > 0.2} in {@code anomalyNote}.</li>
 *   <li>{@code requiresHumanReview = aggregateScore < confidenceThreshold}.</li>
 * </ol>
 *
 * <p>This class is stateless and thread-safe. It logs, but never throws for degenerate input.
 */
public class WeightedScoreStrategy implements ConsensusEngine {

    private static final Logger log = LoggerFactory.getLogger(WeightedScoreStrategy.class);

    public static final String NAME = "weighted_score";
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;
    public static final double DIVERGENCE_THRESHOLD = 0.2;

    static final double STRONG_MAJORITY_RATIO = 0.75;
    static final double MAJORITY_RATIO        = 0.5;

    private final double confidenceThreshold;
    private final Clock clock;

    public WeightedScoreStrategy() {
        this(DEFAULT_CONFIDENCE_THRESHOLD);
    }

    public WeightedScoreStrategy(double confidenceThreshold) {
        this(confidenceThreshold, Clock.systemUTC());
    }

    public WeightedScoreStrategy(double confidenceThreshold, Clock clock) {
        if (Double.isNaN(confidenceThreshold) || confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new ConfigurationException(NAME,
                "confidenceThreshold must be within [0.0, 1.0], got " + confidenceThreshold);
        }
        this.confidenceThreshold = confidenceThreshold;
        this.clock = clock;
    }

    public double confidenceThreshold() {
        return confidenceThreshold;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ConsensusOutcome calculate(List<AgentOpinion> opinions, DecisionContext context) {
        if (opinions == null || opinions.isEmpty()) {
            return ConsensusOutcome.empty(NAME);
        }

        Map<String, Double> weightedScores = new LinkedHashMap<>();
        double totalWeight = 0.0;
        double weightedSum = 0.0;
        for (AgentOpinion opinion : opinions) {
            double weight = opinion.role().weightIn(context);
            double weighted = opinion.confidence() * weight;
            weightedScores.merge(opinion.agentId(), weighted, Double::sum);
            weightedSum += weighted;
            totalWeight += weight;
        }

        if (totalWeight <= 0.0) {
            log.warn("[Consensus] non-positive total weight, falling back to empty outcome. agents={}",
                opinions.size());
            return ConsensusOutcome.empty(NAME);
        }

        // clamped for floating-point safety
        double aggregate = Math.max(0.0, Math.min(1.0, weightedSum / totalWeight));

        VoteTally tally = VoteTally.of(opinions);
        double agreement = tally.weightedAgreementRatio(context);
        ConsensusKind kind = classify(opinions.size(), tally.distinctLabels(), agreement);
        List<String> divergent = divergentAgents(opinions, aggregate);
        String anomalyNote = divergent.isEmpty() ? null
            : String.format("divergence > %.2f from aggregate %.3f for %d agent(s): %s",
                DIVERGENCE_THRESHOLD, aggregate, divergent.size(), String.join(", ", divergent));
        boolean requiresReview = aggregate < confidenceThreshold;

        if (anomalyNote != null) {
            log.warn("[Consensus] anomaly detected. {}", anomalyNote);
        }
        log.info("[Consensus] strategy={} score={} kind={} agents={} requiresReview={}",
            NAME, String.format("%.3f", aggregate), kind.wireName(), opinions.size(), requiresReview);

        return new ConsensusOutcome(aggregate, kind, weightedScores, VoteTally.votes(opinions),
            requiresReview, anomalyNote, divergent, tally.dominantLabel(context),
            agreement, NAME, clock.instant());
    }

    /**
     * Resolves a label tie using role weights: the label with the greatest summed weight wins;
     * equal sums go to the label of the single highest-weight opinion.
     *
     * @return the winning normalised label, or {@code "unknown"} for an empty list
     */
    public String resolveTie(List<AgentOpinion> opinions) {
        return resolveTie(opinions, DecisionContext.empty());
    }

    public String resolveTie(List<AgentOpinion> opinions, DecisionContext context) {
        if (opinions == null || opinions.isEmpty()) {
            return VoteTally.UNKNOWN_LABEL;
        }
        if (opinions.size() == 1) {
            return opinions.get(0).normalizedLabel();
        }
        String winner = VoteTally.resolveByWeight(opinions, context);
        log.info("[Consensus] tie resolved. winner={} agents={}", winner, opinions.size());
        return winner;
    }

    static ConsensusKind classify(int opinionCount, int distinctLabels, double agreementRatio) {
        if (opinionCount == 0) {
            return ConsensusKind.EMPTY;
        }
        if (opinionCount == 1) {
            return ConsensusKind.SINGLE_AGENT;
        }
        if (distinctLabels == 1) {
            return ConsensusKind.UNANIMOUS;
        }
        if (agreementRatio >= STRONG_MAJORITY_RATIO) {
            return ConsensusKind.STRONG_MAJORITY;
        }
        if (agreementRatio >= MAJORITY_RATIO) {
            return ConsensusKind.MAJORITY;
        }
        return ConsensusKind.SPLIT;
    }

    private static List<String> divergentAgents(List<AgentOpinion> opinions, double aggregate) {
        List<String> divergent = new ArrayList<>();
        for (AgentOpinion opinion : opinions) {
            if (Math.abs(opinion.confidence() - aggregate) > DIVERGENCE_THRESHOLD) {
                divergent.add(opinion.agentId());
            }
        }
        return divergent;
    }
}
