package com.triageplatform.orchestrator.agent;

import com.triageplatform.common.exception.ConfigurationException;
import com.triageplatform.common.model.AgentOpinion;
import com.triageplatform.common.model.AgentRole;
import com.triageplatform.common.model.AlertEvent;
import com.triageplatform.common.model.DecisionContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EvaluatorRegistryTest {

    @Nested
    @DisplayName("EvaluatorRegistry")
    class RegistryTests {

        @Test
        @DisplayName("looks evaluators up by id and role, in registration order")
        void lookups() {
            EvaluatorRegistry registry = new EvaluatorRegistry(List.of(
                StubEvaluator.voting("ti-1", AgentRole.THREAT_INTEL, 0.9, "escalate"),
                StubEvaluator.voting("log-1", AgentRole.LOG_ANALYZER, 0.8, "escalate"),
                StubEvaluator.voting("log-2", AgentRole.LOG_ANALYZER, 0.7, "monitor")));

            assertEquals(3, registry.size());
            assertEquals(List.of("ti-1", "log-1", "log-2"),
                registry.all().stream().map(EvaluatorAgent::agentId).toList());
            assertEquals(2, registry.byRole(AgentRole.LOG_ANALYZER).size());
            assertTrue(registry.find("ti-1").isPresent());
            assertTrue(registry.find("nope").isEmpty());
        }

        @Test
        @DisplayName("duplicate agent id → ConfigurationException")
        void duplicateIds() {
            assertThrows(ConfigurationException.class, () -> new EvaluatorRegistry(List.of(
                StubEvaluator.voting("ti-1", AgentRole.THREAT_INTEL, 0.9, "escalate"),
                StubEvaluator.voting("ti-1", AgentRole.THREAT_INTEL, 0.8, "monitor"))));
        }
    }

    @Nested
    @DisplayName("SeverityPolicyEvaluator")
    class SeverityPolicyTests {

        private final SeverityPolicyEvaluator evaluator = new SeverityPolicyEvaluator(
            Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));

        private AgentOpinion evaluate(String eventType, String severity, Map<String, Object> payload) {
            return evaluator.evaluate(AlertEvent.of("alert-1", eventType, "prometheus", severity, payload),
                DecisionContext.empty()).block();
        }

        @Test
        @DisplayName("critical → escalate at 0.9, one evidence item per payload entry")
        void critical() {
            AgentOpinion opinion = evaluate("HighCpuUsage", "CRITICAL", Map.of("instance", "web-1", "job", "node"));
            assertEquals("escalate", opinion.resultLabel());
            assertEquals(0.9, opinion.confidence(), 1e-9);
            assertEquals(2, opinion.evidenceCount());
            assertEquals(AgentRole.POLICY_ENGINE, opinion.role());
        }

        @Test
        @DisplayName("security alerts get a small confidence bonus")
        void securityBonus() {
            AgentOpinion opinion = evaluate("security_login_failure", "low", Map.of());
            assertEquals("ok", opinion.resultLabel());
            assertEquals(0.75, opinion.confidence(), 1e-9);
        }

        @Test
        @DisplayName("unknown severity → monitor at 0.5")
        void unknownSeverity() {
            AgentOpinion opinion = evaluate("DiskFull", null, null);
            assertEquals("monitor", opinion.resultLabel());
            assertEquals(0.5, opinion.confidence(), 1e-9);
            assertEquals(0, opinion.evidenceCount());
        }
    }
}
