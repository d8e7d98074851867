package com.triageplatform.orchestrator.agent;

import com.triageplatform.common.exception.ConfigurationException;
import com.triageplatform.common.model.AgentRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of evaluators consulted by each round, keyed by agent id.
 */
@Component
public class EvaluatorRegistry {

    private static final Logger log = LoggerFactory.getLogger(EvaluatorRegistry.class);

    private final Map<String, EvaluatorAgent> agents;

    @Autowired
    public EvaluatorRegistry(ObjectProvider<EvaluatorAgent> agents) {
        this(agents.orderedStream().toList());
    }

    /**
     * @throws ConfigurationException when two evaluators share an agent id
     */
    public EvaluatorRegistry(List<EvaluatorAgent> agents) {
        Map<String, EvaluatorAgent> byId = new LinkedHashMap<>();
        for (EvaluatorAgent agent : agents) {
            if (byId.putIfAbsent(agent.agentId(), agent) != null) {
                throw new ConfigurationException("EvaluatorRegistry", "duplicate evaluator id " + agent.agentId());
            }
        }
        this.agents = Collections.unmodifiableMap(byId);
        log.info("[Registry] evaluators={}", this.agents.keySet());
    }

    public List<EvaluatorAgent> all() {
        return new ArrayList<>(agents.values());
    }

    public Optional<EvaluatorAgent> find(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public List<EvaluatorAgent> byRole(AgentRole role) {
        return agents.values().stream().filter(a -> a.role() == role).toList();
    }

    public int size() {
        return agents.size();
    }
}
