package com.triageplatform.orchestrator.pipeline;

import com.triageplatform.common.confidence.ConfidenceAssessment;
import com.triageplatform.common.confidence.ConfidencePolicy;
import com.triageplatform.common.confidence.EvidenceItem;
import com.triageplatform.common.consensus.ConsensusEngine;
import com.triageplatform.common.consensus.ConsensusKind;
import com.triageplatform.common.consensus.ConsensusOutcome;
import com.triageplatform.common.model.AgentOpinion;
import com.triageplatform.common.model.DecisionContext;
import com.triageplatform.common.model.DecisionReason;
import com.triageplatform.common.model.DecisionRecord;
import com.triageplatform.common.model.DecisionState;
import com.triageplatform.orchestrator.guard.ConsensusIntegrationGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Decision state machine: consensus, then confidence, then the transition rules.
 *
 * <p>Pure computation, no I/O. Persistence of the result belongs to {@code DecisionOrchestrator}.
 *
 * <h3>Transition order</h3>
 * <ol>
 *   <li>No opinions → INVESTIGATING / INSUFFICIENT_DATA</li>
 *   <li>Weighted score &lt; 0.7 → PENDING_HUMAN_APPROVAL / LOW_CONFIDENCE</li>
 *   <li>Confidence anomaly (likely or worse) or consensus anomaly note
 *       → PENDING_HUMAN_APPROVAL / HALLUCINATION_DETECTED</li>
 *   <li>Unanimous and score &gt; 0.85 → state of the shared label / UNANIMOUS_AGREEMENT</li>
 *   <li>Majority or strong majority and score &gt; 0.8 → state of the dominant label / MAJORITY_VOTE</li>
 *   <li>Otherwise → PENDING_HUMAN_APPROVAL / CONFLICTING_OPINIONS
 *       (EXPERT_DECISION for a single opinion)</li>
 * </ol>
 *
 * <p>Unanimous rounds scoring in [0.7, 0.85] fall through to rule 6 and still wait for a human.
 */
@Component
public class DecisionPipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionPipelineEngine.class);

    public static final double LOW_CONFIDENCE_THRESHOLD  = 0.7;
    public static final double UNANIMOUS_AUTO_THRESHOLD  = 0.85;
    public static final double MAJORITY_AUTO_THRESHOLD   = 0.8;
    public static final double EVIDENCE_COUNT_WEIGHT     = 0.1;

    private final ConsensusEngine consensusEngine;
    private final ConfidencePolicy confidencePolicy;
    private final Clock clock;

    public DecisionPipelineEngine(ConsensusEngine consensusEngine, ConfidencePolicy confidencePolicy, Clock clock) {
        this.consensusEngine  = consensusEngine;
        this.confidencePolicy = confidencePolicy;
        this.clock            = clock;
    }

    public String strategyName() {
        return consensusEngine.name();
    }

    /**
     * Runs consensus, confidence and the transition rules over one round's opinions.
     * Anomalies are carried in the result, never thrown.
     */
    public DecisionEvaluation evaluate(List<AgentOpinion> opinions, DecisionContext context) {
        List<AgentOpinion> round = opinions == null ? List.of() : List.copyOf(opinions);
        DecisionContext ctx = context == null ? DecisionContext.empty() : context;

        ConsensusOutcome consensus = ConsensusIntegrationGuard.resolve(round, consensusEngine, ctx);
        ConfidenceAssessment assessment = confidencePolicy.calculate(consensus.aggregateScore(), toEvidence(round), ctx);

        Transition transition = transition(round, consensus, assessment);
        boolean review = consensus.requiresHumanReview()
            || assessment.anomalyFlag().forcesReview()
            || transition.state().awaitsHuman();

        DecisionRecord record = DecisionRecord.create(transition.state(), transition.reason(),
            assessment.finalScore(), consensus.aggregateScore(), review,
            evidenceSummary(round, consensus), metadata(round, consensus, assessment, ctx), clock.instant());

        log.info("[Pipeline] decision state={} reason={} weighted={} confidence={} review={} threadId={}",
            record.state().wireName(), record.reason().wireName(),
            String.format("%.3f", record.weightedScore()), String.format("%.3f", record.confidenceScore()),
            record.requiresHumanReview(), ctx.threadId());
        return new DecisionEvaluation(record, round, consensus, assessment, false);
    }

    /**
     * Result for a round cancelled by its overall timeout: INVESTIGATING with no opinions.
     */
    public DecisionEvaluation timedOut(DecisionContext context, Duration roundTimeout) {
        DecisionContext ctx = context == null ? DecisionContext.empty() : context;
        ConsensusOutcome consensus = ConsensusOutcome.empty(consensusEngine.name());
        ConfidenceAssessment assessment = confidencePolicy.calculate(0.0, List.of(), ctx);

        Map<String, Object> metadata = metadata(List.of(), consensus, assessment, ctx);
        metadata.put("roundTimedOut", true);
        metadata.put("roundTimeoutMs", roundTimeout.toMillis());

        String summary = "round timed out after " + roundTimeout.toMillis() + "ms | "
            + evidenceSummary(List.of(), consensus);
        DecisionRecord record = DecisionRecord.create(DecisionState.INVESTIGATING, DecisionReason.INSUFFICIENT_DATA,
            0.0, 0.0, true, summary, metadata, clock.instant());
        log.warn("[Pipeline] round timed out, investigating. timeoutMs={} threadId={}",
            roundTimeout.toMillis(), ctx.threadId());
        return new DecisionEvaluation(record, List.of(), consensus, assessment, true);
    }

    /**
     * Label → state: {@code escalate}/{@code reject} escalate, {@code approve}/{@code ok}
     * approve, anything else is monitored.
     */
    public static DecisionState stateForLabel(String label) {
        String normalized = label == null ? "" : label.toLowerCase(Locale.ROOT);
        if (normalized.contains("escalate") || normalized.contains("reject")) {
            return DecisionState.ESCALATED;
        }
        if (normalized.contains("approve") || normalized.contains("ok")) {
            return DecisionState.APPROVED;
        }
        return DecisionState.MONITORING;
    }

    // ── internals ──────────────────────────────────────────────────────────

    private record Transition(DecisionState state, DecisionReason reason) {}

    private Transition transition(List<AgentOpinion> opinions, ConsensusOutcome consensus,
                                  ConfidenceAssessment assessment) {
        double score = consensus.aggregateScore();
        ConsensusKind kind = consensus.consensusKind();

        if (opinions.isEmpty()) {
            return new Transition(DecisionState.INVESTIGATING, DecisionReason.INSUFFICIENT_DATA);
        }
        if (score < LOW_CONFIDENCE_THRESHOLD) {
            return new Transition(DecisionState.PENDING_HUMAN_APPROVAL, DecisionReason.LOW_CONFIDENCE);
        }
        if (assessment.anomalyFlag().forcesReview() || consensus.hasAnomaly()) {
            log.warn("[Pipeline] anomaly forces review. flag={} note={}",
                assessment.anomalyFlag().wireName(), consensus.anomalyNote());
            return new Transition(DecisionState.PENDING_HUMAN_APPROVAL, DecisionReason.HALLUCINATION_DETECTED);
        }
        if (kind == ConsensusKind.UNANIMOUS && score > UNANIMOUS_AUTO_THRESHOLD) {
            return new Transition(stateForLabel(labelOf(consensus, opinions)), DecisionReason.UNANIMOUS_AGREEMENT);
        }
        if (kind.isMajority() && score > MAJORITY_AUTO_THRESHOLD) {
            return new Transition(stateForLabel(labelOf(consensus, opinions)), DecisionReason.MAJORITY_VOTE);
        }
        return new Transition(DecisionState.PENDING_HUMAN_APPROVAL,
            opinions.size() == 1 ? DecisionReason.EXPERT_DECISION : DecisionReason.CONFLICTING_OPINIONS);
    }

    private static String labelOf(ConsensusOutcome consensus, List<AgentOpinion> opinions) {
        return consensus.dominantLabel() != null ? consensus.dominantLabel() : opinions.get(0).normalizedLabel();
    }

    /** One evidence item per opinion; opinions backed by more evidence weigh more. */
    static List<EvidenceItem> toEvidence(List<AgentOpinion> opinions) {
        List<EvidenceItem> evidence = new ArrayList<>(opinions.size());
        for (AgentOpinion opinion : opinions) {
            evidence.add(new EvidenceItem(
                opinion.agentId() + " (" + opinion.role().wireName() + ")",
                opinion.confidence(),
                1.0 + EVIDENCE_COUNT_WEIGHT * opinion.evidenceCount(),
                opinion.rationale()));
        }
        return evidence;
    }

    static String evidenceSummary(List<AgentOpinion> opinions, ConsensusOutcome consensus) {
        Map<String, List<String>> votersByLabel = new LinkedHashMap<>();
        for (AgentOpinion opinion : opinions) {
            votersByLabel.computeIfAbsent(opinion.normalizedLabel(), k -> new ArrayList<>()).add(opinion.agentId());
        }
        List<String> parts = new ArrayList<>();
        votersByLabel.forEach((label, voters) ->
            parts.add(voters.size() + " agent(s) voted '" + label + "': " + String.join(", ", voters)));
        parts.add(String.format(Locale.ROOT, "weighted score: %.1f%%", consensus.aggregateScore() * 100.0));
        parts.add("consensus: " + consensus.consensusKind().wireName());
        return String.join(" | ", parts);
    }

    private static Map<String, Object> metadata(List<AgentOpinion> opinions, ConsensusOutcome consensus,
                                                ConfidenceAssessment assessment, DecisionContext ctx) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("consensusKind", consensus.consensusKind().wireName());
        metadata.put("agentCount", opinions.size());
        metadata.put("weightedScore", consensus.aggregateScore());
        if (consensus.hasAnomaly()) {
            metadata.put("anomalyNote", consensus.anomalyNote());
        }
        metadata.put("divergencePercentage", assessment.divergencePercentage());
        metadata.put("confidenceLevel", assessment.confidenceLevel().wireName());
        metadata.put("strategy", consensus.strategyName());
        if (ctx.hasThread()) {
            metadata.put("threadId", ctx.threadId());
        }
        return metadata;
    }
}
