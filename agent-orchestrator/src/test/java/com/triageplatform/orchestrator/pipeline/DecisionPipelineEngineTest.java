package com.triageplatform.orchestrator.pipeline;

import com.triageplatform.common.confidence.AnomalyFlag;
import com.triageplatform.common.confidence.ConfidencePolicy;
import com.triageplatform.common.consensus.ConsensusKind;
import com.triageplatform.common.consensus.WeightedScoreStrategy;
import com.triageplatform.common.model.AgentOpinion;
import com.triageplatform.common.model.AgentRole;
import com.triageplatform.common.model.DecisionContext;
import com.triageplatform.common.model.DecisionReason;
import com.triageplatform.common.model.DecisionRecord;
import com.triageplatform.common.model.DecisionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DecisionPipelineEngineTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private static final DecisionContext CTX = DecisionContext.forThread("exec_1", "trace-1", false);

    private DecisionPipelineEngine engine;

    @BeforeEach
    void setUp() {
        engine = new DecisionPipelineEngine(new WeightedScoreStrategy(0.7, FIXED), new ConfidencePolicy(1.0, FIXED), FIXED);
    }

    private static AgentOpinion opinion(String id, AgentRole role, double confidence, String label) {
        return AgentOpinion.of(id, role, confidence, 0, label, "");
    }

    private static List<AgentOpinion> referenceRound() {
        return List.of(
            opinion("ti-1", AgentRole.THREAT_INTEL, 0.9, "escalate"),
            opinion("log-1", AgentRole.LOG_ANALYZER, 0.85, "escalate"),
            opinion("metrics-1", AgentRole.METRICS_ANALYZER, 0.7, "monitor"));
    }

    // ── transition rules ───────────────────────────────────────────────────

    @Nested
    @DisplayName("transition rules")
    class TransitionTests {

        @Test
        @DisplayName("weighted strong majority above 0.8 → ESCALATED / MAJORITY_VOTE")
        void strongMajorityEscalates() {
            DecisionEvaluation evaluation = engine.evaluate(referenceRound(), CTX);
            DecisionRecord record = evaluation.record();

            assertEquals(0.839, evaluation.consensus().aggregateScore(), 0.001);
            assertEquals(ConsensusKind.STRONG_MAJORITY, evaluation.consensus().consensusKind());
            assertEquals(DecisionState.ESCALATED, record.state());
            assertEquals(DecisionReason.MAJORITY_VOTE, record.reason());
            assertFalse(record.requiresHumanReview());
            assertEquals(DecisionState.ESCALATED.recommendedAction(), record.recommendedAction());
            assertFalse(evaluation.timedOut());
        }

        @Test
        @DisplayName("unanimous at 0.8 stays in the review band → PENDING_HUMAN_APPROVAL")
        void unanimousDeadZone() {
            DecisionRecord record = engine.evaluate(List.of(
                opinion("ti-1", AgentRole.THREAT_INTEL, 0.8, "approve"),
                opinion("log-1", AgentRole.LOG_ANALYZER, 0.8, "approve"),
                opinion("metrics-1", AgentRole.METRICS_ANALYZER, 0.8, "approve")), CTX).record();

            assertEquals(0.8, record.weightedScore(), 1e-9);
            assertEquals(DecisionState.PENDING_HUMAN_APPROVAL, record.state());
            assertEquals(DecisionReason.CONFLICTING_OPINIONS, record.reason());
            assertTrue(record.requiresHumanReview());
        }

        @Test
        @DisplayName("unanimous above 0.85 → state of the shared label / UNANIMOUS_AGREEMENT")
        void unanimousApproves() {
            DecisionRecord record = engine.evaluate(List.of(
                opinion("ti-1", AgentRole.THREAT_INTEL, 0.9, "approve"),
                opinion("log-1", AgentRole.LOG_ANALYZER, 0.9, "Approve")), CTX).record();

            assertEquals(DecisionState.APPROVED, record.state());
            assertEquals(DecisionReason.UNANIMOUS_AGREEMENT, record.reason());
            assertFalse(record.requiresHumanReview());
        }

        @Test
        @DisplayName("no opinions → INVESTIGATING / INSUFFICIENT_DATA, no exception")
        void noOpinions() {
            DecisionEvaluation evaluation = engine.evaluate(List.of(), CTX);
            assertEquals(DecisionState.INVESTIGATING, evaluation.record().state());
            assertEquals(DecisionReason.INSUFFICIENT_DATA, evaluation.record().reason());
            assertEquals(0.0, evaluation.record().weightedScore());
            assertTrue(evaluation.record().requiresHumanReview());
            assertEquals(ConsensusKind.EMPTY, evaluation.consensus().consensusKind());
        }

        @Test
        @DisplayName("weighted score below 0.7 → LOW_CONFIDENCE")
        void lowConfidence() {
            DecisionRecord record = engine.evaluate(List.of(
                opinion("ti-1", AgentRole.THREAT_INTEL, 0.5, "escalate"),
                opinion("log-1", AgentRole.LOG_ANALYZER, 0.6, "escalate")), CTX).record();

            assertEquals(DecisionState.PENDING_HUMAN_APPROVAL, record.state());
            assertEquals(DecisionReason.LOW_CONFIDENCE, record.reason());
            assertTrue(record.requiresHumanReview());
        }

        @Test
        @DisplayName("divergent opinion recorded by consensus → HALLUCINATION_DETECTED")
        void consensusAnomaly() {
            DecisionEvaluation evaluation = engine.evaluate(List.of(
                opinion("ti-1", AgentRole.THREAT_INTEL, 0.95, "escalate"),
                opinion("log-1", AgentRole.LOG_ANALYZER, 0.95, "escalate"),
                opinion("metrics-1", AgentRole.METRICS_ANALYZER, 0.5, "escalate")), CTX);

            assertTrue(evaluation.consensus().hasAnomaly());
            assertEquals(DecisionReason.HALLUCINATION_DETECTED, evaluation.record().reason());
            assertEquals(DecisionState.PENDING_HUMAN_APPROVAL, evaluation.record().state());
            assertNotNull(evaluation.record().metadata().get("anomalyNote"));
        }

        @Test
        @DisplayName("likely confidence anomaly → HALLUCINATION_DETECTED even when consensus is clean")
        void confidenceAnomaly() {
            DecisionPipelineEngine dampened = new DecisionPipelineEngine(
                new WeightedScoreStrategy(0.7, FIXED), new ConfidencePolicy(0.5, FIXED), FIXED);

            DecisionEvaluation evaluation = dampened.evaluate(List.of(
                opinion("ti-1", AgentRole.THREAT_INTEL, 0.9, "escalate"),
                opinion("log-1", AgentRole.LOG_ANALYZER, 0.9, "escalate")), CTX);

            assertFalse(evaluation.consensus().hasAnomaly());
            assertEquals(AnomalyFlag.LIKELY, evaluation.assessment().anomalyFlag());
            assertEquals(DecisionReason.HALLUCINATION_DETECTED, evaluation.record().reason());
            assertTrue(evaluation.record().requiresHumanReview());
        }

        @Test
        @DisplayName("single opinion → PENDING_HUMAN_APPROVAL / EXPERT_DECISION")
        void singleOpinion() {
            DecisionRecord record = engine.evaluate(List.of(
                opinion("analyst", AgentRole.HUMAN_ANALYST, 0.9, "escalate")), CTX).record();

            assertEquals(DecisionState.PENDING_HUMAN_APPROVAL, record.state());
            assertEquals(DecisionReason.EXPERT_DECISION, record.reason());
        }

        @Test
        @DisplayName("three-way split → CONFLICTING_OPINIONS")
        void split() {
            DecisionEvaluation evaluation = engine.evaluate(List.of(
                opinion("ti-1", AgentRole.THREAT_INTEL, 0.9, "escalate"),
                opinion("log-1", AgentRole.LOG_ANALYZER, 0.9, "approve"),
                opinion("metrics-1", AgentRole.METRICS_ANALYZER, 0.9, "monitor")), CTX);

            assertEquals(ConsensusKind.SPLIT, evaluation.consensus().consensusKind());
            assertEquals(DecisionReason.CONFLICTING_OPINIONS, evaluation.record().reason());
        }
    }

    // ── record contents ────────────────────────────────────────────────────

    @Test
    @DisplayName("evidence summary lists voters per label, then score and kind")
    void evidenceSummary() {
        DecisionRecord record = engine.evaluate(referenceRound(), CTX).record();
        assertEquals("2 agent(s) voted 'escalate': ti-1, log-1 | 1 agent(s) voted 'monitor': metrics-1"
                + " | weighted score: 83.9% | consensus: strong_majority",
            record.evidenceSummary());
    }

    @Test
    @DisplayName("metadata carries consensus, confidence and thread details")
    void metadata() {
        DecisionEvaluation evaluation = engine.evaluate(referenceRound(), CTX);
        DecisionRecord record = evaluation.record();

        assertEquals("strong_majority", record.metadata().get("consensusKind"));
        assertEquals(3, record.metadata().get("agentCount"));
        assertEquals(WeightedScoreStrategy.NAME, record.metadata().get("strategy"));
        assertEquals("exec_1", record.metadata().get("threadId"));
        assertFalse(record.metadata().containsKey("anomalyNote"));
        assertEquals(evaluation.assessment().finalScore(), record.confidenceScore());
        assertTrue(record.confidenceScore() > record.weightedScore());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), record.timestamp());
    }

    @Test
    @DisplayName("evidence weight grows with the opinion's evidence count")
    void evidenceWeights() {
        List<AgentOpinion> opinions = List.of(AgentOpinion.of("ti-1", AgentRole.THREAT_INTEL, 0.9, 5, "escalate", "ioc"));
        assertEquals(1.5, DecisionPipelineEngine.toEvidence(opinions).get(0).weight(), 1e-9);
        assertEquals("ti-1 (threat_intel)", DecisionPipelineEngine.toEvidence(opinions).get(0).source());
    }

    @Test
    @DisplayName("label mapping: escalate/reject, approve/ok, everything else")
    void labelMapping() {
        assertEquals(DecisionState.ESCALATED, DecisionPipelineEngine.stateForLabel("escalate"));
        assertEquals(DecisionState.ESCALATED, DecisionPipelineEngine.stateForLabel("REJECT_CHANGE"));
        assertEquals(DecisionState.APPROVED, DecisionPipelineEngine.stateForLabel("approve"));
        assertEquals(DecisionState.APPROVED, DecisionPipelineEngine.stateForLabel("ok"));
        assertEquals(DecisionState.MONITORING, DecisionPipelineEngine.stateForLabel("monitor"));
        assertEquals(DecisionState.MONITORING, DecisionPipelineEngine.stateForLabel(null));
    }

    @Test
    @DisplayName("timed-out round → INVESTIGATING, flagged so it is never checkpointed")
    void timedOut() {
        DecisionEvaluation evaluation = engine.timedOut(CTX, Duration.ofSeconds(30));
        assertTrue(evaluation.timedOut());
        assertEquals(DecisionState.INVESTIGATING, evaluation.record().state());
        assertEquals(DecisionReason.INSUFFICIENT_DATA, evaluation.record().reason());
        assertTrue(evaluation.record().requiresHumanReview());
        assertEquals(true, evaluation.record().metadata().get("roundTimedOut"));
        assertTrue(evaluation.record().evidenceSummary().startsWith("round timed out after 30000ms"));
    }
}
