package com.triageplatform.common.consensus;

import com.triageplatform.common.exception.ConfigurationException;
import com.triageplatform.common.model.AgentOpinion;
import com.triageplatform.common.model.DecisionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Simple-majority strategy. The most common label must be backed by at least
 * {@code majorityThreshold} of the opinions; below that the outcome is
 * {@link ConsensusKind#NO_MAJORITY} with score 0. Agreement here counts opinions, not weight.
 *
 * <p>A met threshold still requires review unless agreement reaches the strong-majority ratio (0.75).
 */
public class MajorityStrategy implements ConsensusEngine {

    private static final Logger log = LoggerFactory.getLogger(MajorityStrategy.class);

    public static final String NAME = "majority";
    public static final double DEFAULT_MAJORITY_THRESHOLD = 0.5;

    private final double majorityThreshold;
    private final Clock clock;

    public MajorityStrategy() {
        this(DEFAULT_MAJORITY_THRESHOLD);
    }

    public MajorityStrategy(double majorityThreshold) {
        this(majorityThreshold, Clock.systemUTC());
    }

    public MajorityStrategy(double majorityThreshold, Clock clock) {
        if (Double.isNaN(majorityThreshold) || majorityThreshold <= 0.0 || majorityThreshold > 1.0) {
            throw new ConfigurationException(NAME,
                "majorityThreshold must be within (0.0, 1.0], got " + majorityThreshold);
        }
        this.majorityThreshold = majorityThreshold;
        this.clock = clock;
    }

    public double majorityThreshold() {
        return majorityThreshold;
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
        double ratio = tally.agreementRatio();
        String dominant = tally.dominantLabel(context);

        if (ratio < majorityThreshold) {
            log.info("[Consensus] strategy={} no majority. ratio={} threshold={}",
                NAME, String.format("%.2f", ratio), majorityThreshold);
            return new ConsensusOutcome(0.0, ConsensusKind.NO_MAJORITY,
                UnanimousStrategy.weightedScores(opinions, context), VoteTally.votes(opinions),
                true, null, List.of(), dominant, ratio, NAME, clock.instant());
        }

        double score = VoteTally.averageConfidence(opinions);
        ConsensusKind kind = WeightedScoreStrategy.classify(opinions.size(), tally.distinctLabels(), ratio);
        // thresholds below 0.5 can accept a round that classify() reports as split
        if (kind == ConsensusKind.SPLIT) {
            kind = ConsensusKind.MAJORITY;
        }
        boolean requiresReview = ratio < WeightedScoreStrategy.STRONG_MAJORITY_RATIO;
        log.info("[Consensus] strategy={} score={} kind={} ratio={} requiresReview={}",
            NAME, String.format("%.3f", score), kind.wireName(), String.format("%.2f", ratio), requiresReview);
        return new ConsensusOutcome(score, kind, UnanimousStrategy.weightedScores(opinions, context),
            VoteTally.votes(opinions), requiresReview, null, List.of(), dominant, ratio, NAME, clock.instant());
    }
}
