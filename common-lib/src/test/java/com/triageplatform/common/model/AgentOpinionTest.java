package com.triageplatform.common.model;

import com.triageplatform.common.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgentOpinionTest {

    @Test
    @DisplayName("out-of-range confidence and negative evidence rejected")
    void rejectsMalformed() {
        assertThrows(ValidationException.class,
            () -> AgentOpinion.of("a", AgentRole.THREAT_INTEL, 1.01, 0, "escalate", ""));
        assertThrows(ValidationException.class,
            () -> AgentOpinion.of("a", AgentRole.THREAT_INTEL, 0.5, -1, "escalate", ""));
        assertThrows(ValidationException.class,
            () -> AgentOpinion.of("a", null, 0.5, 0, "escalate", ""));
        assertThrows(ValidationException.class,
            () -> AgentOpinion.of(" ", AgentRole.THREAT_INTEL, 0.5, 0, "escalate", ""));
        assertThrows(ValidationException.class,
            () -> AgentOpinion.of("a", AgentRole.THREAT_INTEL, 0.5, 0, "", ""));
    }

    @Test
    @DisplayName("role weights and security boost")
    void roleWeights() {
        DecisionContext security = DecisionContext.forThread("t", "trace", true);
        assertEquals(2.0, AgentRole.THREAT_INTEL.weightIn(DecisionContext.empty()));
        assertEquals(3.0, AgentRole.THREAT_INTEL.weightIn(security));
        assertEquals(1.5, AgentRole.LOG_ANALYZER.weightIn(security));
        assertEquals(3.0, AgentRole.HUMAN_ANALYST.weightIn(null));
        assertEquals(AgentRole.LOG_ANALYZER, AgentRole.fromWireName("log-analyzer"));
        assertThrows(IllegalArgumentException.class, () -> AgentRole.fromWireName("oracle"));
    }

    @Test
    @DisplayName("decision record copies keep the original untouched")
    void decisionRecordCopies() {
        DecisionRecord record = DecisionRecord.create(DecisionState.ESCALATED, DecisionReason.MAJORITY_VOTE,
            0.9, 0.84, false, "summary", Map.of("agentCount", 3), Instant.EPOCH);
        DecisionRecord withCheckpoint = record.withCheckpointId("cp-1");
        DecisionRecord validated = withCheckpoint.withValidation(
            HumanValidation.of(record.id(), true, "analyst", null, Instant.EPOCH));

        assertNull(record.checkpointId());
        assertEquals("cp-1", validated.checkpointId());
        assertTrue(validated.isValidated());
        assertEquals(record.confidenceScore(), validated.confidenceScore());
        assertEquals(DecisionState.ESCALATED.recommendedAction(), record.recommendedAction());
    }
}
