package com.triageplatform.common.consensus;

import com.triageplatform.common.exception.ConfigurationException;
import com.triageplatform.common.model.AgentOpinion;
import com.triageplatform.common.model.DecisionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strict strategy: an outcome is only scored when every opinion carries the same label.
 * Any disagreement yields {@link ConsensusKind#NO_UNANIMOUS_AGREEMENT} with score 0 and
 * mandatory review.
 */
public class UnanimousStrategy implements ConsensusEngine {

    private static final Logger log = LoggerFactory.getLogger(UnanimousStrategy.class);

    public static final String NAME = "unanimous";

    private final double confidenceThreshold;
    private final Clock clock;

    public UnanimousStrategy() {
        this(WeightedScoreStrategy.DEFAULT_CONFIDENCE_THRESHOLD, Clock.systemUTC());
    }

    public UnanimousStrategy(double confidenceThreshold, Clock clock) {
        if (Double.isNaN(confidenceThreshold) || confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new ConfigurationException(NAME,
                "confidenceThreshold must be within [0.0, 1.0], got " + confidenceThreshold);
        }
        this.confidenceThreshold = confidenceThreshold;
        this.clock = clock;
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

        VoteTally tally = VoteTally.of(opinions);
        Map<String, Double> weighted = weightedScores(opinions, context);

        if (tally.distinctLabels() > 1) {
            log.info("[Consensus] strategy={} no unanimous agreement. labels={} agents={}",
                NAME, tally.distinctLabels(), opinions.size());
            return new ConsensusOutcome(0.0, ConsensusKind.NO_UNANIMOUS_AGREEMENT, weighted,
                VoteTally.votes(opinions), true, null, List.of(), tally.dominantLabel(context),
                tally.agreementRatio(), NAME, clock.instant());
        }

        double score = VoteTally.averageConfidence(opinions);
        ConsensusKind kind = opinions.size() == 1 ? ConsensusKind.SINGLE_AGENT : ConsensusKind.UNANIMOUS;
        boolean requiresReview = score < confidenceThreshold;
        log.info("[Consensus] strategy={} score={} kind={} requiresReview={}",
            NAME, String.format("%.3f", score), kind.wireName(), requiresReview);
        return new ConsensusOutcome(score, kind, weighted, VoteTally.votes(opinions), requiresReview,
            null, List.of(), opinions.get(0).normalizedLabel(), 1.0, NAME, clock.instant());
    }

    static Map<String, Double> weightedScores(List<AgentOpinion> opinions, DecisionContext context) {
        Map<String, Double> weighted = new LinkedHashMap<>();
        for (AgentOpinion opinion : opinions) {
            weighted.merge(opinion.agentId(), opinion.confidence() * opinion.role().weightIn(context), Double::sum);
        }
        return weighted;
    }
}
