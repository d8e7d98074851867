package com.triageplatform.orchestrator.config;

import com.triageplatform.common.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Round timing, bound from {@code triage.round.*}. The round timeout bounds opinion
 * collection and evaluation; checkpointing runs after it.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "triage.round")
public class RoundProperties {

    private Duration agentTimeout = Duration.ofSeconds(10);
    private Duration roundTimeout = Duration.ofSeconds(30);

    @PostConstruct
    public void validate() {
        if (agentTimeout == null || agentTimeout.isZero() || agentTimeout.isNegative()) {
            throw new ConfigurationException("RoundProperties",
                "triage.round.agent-timeout must be positive, got " + agentTimeout);
        }
        if (roundTimeout == null || roundTimeout.isZero() || roundTimeout.isNegative()) {
            throw new ConfigurationException("RoundProperties",
                "triage.round.round-timeout must be positive, got " + roundTimeout);
        }
    }
}
