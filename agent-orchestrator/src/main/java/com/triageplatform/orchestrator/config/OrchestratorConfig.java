package com.triageplatform.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.triageplatform.common.confidence.ConfidencePolicy;
import com.triageplatform.common.consensus.ConsensusEngine;
import com.triageplatform.common.consensus.MajorityStrategy;
import com.triageplatform.common.consensus.UnanimousStrategy;
import com.triageplatform.common.consensus.WeightedScoreStrategy;
import com.triageplatform.common.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Locale;

@Configuration
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * {@code triage.consensus.strategy}: {@code weighted} (default), {@code unanimous} or {@code majority}.
     */
    @Bean
    public ConsensusEngine consensusEngine(
            @Value("${triage.consensus.strategy:weighted}") String strategy,
            @Value("${triage.consensus.confidence-threshold:0.7}") double confidenceThreshold,
            @Value("${triage.consensus.majority-threshold:0.5}") double majorityThreshold,
            Clock clock) {
        ConsensusEngine engine = switch (strategy.trim().toLowerCase(Locale.ROOT)) {
            case "weighted", WeightedScoreStrategy.NAME -> new WeightedScoreStrategy(confidenceThreshold, clock);
            case "unanimous" -> new UnanimousStrategy(confidenceThreshold, clock);
            case "majority"  -> new MajorityStrategy(majorityThreshold, clock);
            default -> throw new ConfigurationException("OrchestratorConfig",
                "unknown triage.consensus.strategy '" + strategy + "', expected weighted|unanimous|majority");
        };
        log.info("[Config] consensus strategy={} confidenceThreshold={} majorityThreshold={}",
            engine.name(), confidenceThreshold, majorityThreshold);
        return engine;
    }

    @Bean
    public ConfidencePolicy confidencePolicy(@Value("${triage.confidence.base-weight:1.0}") double baseWeight,
                                             Clock clock) {
        return new ConfidencePolicy(baseWeight, clock);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
