package com.triageplatform.orchestrator.agent;

import com.triageplatform.common.model.AgentOpinion;
import com.triageplatform.common.model.AgentRole;
import com.triageplatform.common.model.AlertEvent;
import com.triageplatform.common.model.DecisionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Locale;

/**
 * Built-in policy evaluator: maps the alert's declared severity onto a vote.
 *
 * <pre>
 *   critical            escalate  0.90
 *   high | error        escalate  0.80
 *   warning | medium    monitor   0.75
 *   low | info          ok        0.70
 *   anything else       monitor   0.50
 * </pre>
 *
 * Security-related alerts add 0.05, capped at 1.0. Each payload entry counts as one
 * piece of evidence.
 */
@Component
@ConditionalOnProperty(prefix = "triage.evaluators.severity-policy", name = "enabled", havingValue = "true",
                       matchIfMissing = true)
public class SeverityPolicyEvaluator implements EvaluatorAgent {

    private static final Logger log = LoggerFactory.getLogger(SeverityPolicyEvaluator.class);

    public static final String AGENT_ID = "severity-policy";
    private static final double SECURITY_BONUS = 0.05;

    private final Clock clock;

    public SeverityPolicyEvaluator(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String agentId() { return AGENT_ID; }

    @Override
    public AgentRole role() { return AgentRole.POLICY_ENGINE; }

    @Override
    public Mono<AgentOpinion> evaluate(AlertEvent event, DecisionContext context) {
        return Mono.fromCallable(() -> {
            String severity = event.severity() == null ? "" : event.severity().trim().toLowerCase(Locale.ROOT);
            String label;
            double confidence;
            switch (severity) {
                case "critical"           -> { label = "escalate"; confidence = 0.90; }
                case "high", "error"      -> { label = "escalate"; confidence = 0.80; }
                case "warning", "medium"  -> { label = "monitor";  confidence = 0.75; }
                case "low", "info"        -> { label = "ok";       confidence = 0.70; }
                default                   -> { label = "monitor";  confidence = 0.50; }
            }
            if (event.isSecurityRelated()) {
                confidence = Math.min(1.0, confidence + SECURITY_BONUS);
            }
            log.debug("[SeverityPolicy] source={} severity={} label={} confidence={}",
                event.sourceId(), severity, label, confidence);
            return new AgentOpinion(AGENT_ID, AgentRole.POLICY_ENGINE, confidence, event.payload().size(), label,
                "severity=" + (severity.isEmpty() ? "unknown" : severity) + " mapped to " + label,
                clock.instant());
        });
    }
}
