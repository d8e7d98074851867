package com.triageplatform.orchestrator.service;

import com.triageplatform.common.exception.ConfigurationException;
import com.triageplatform.common.exception.ValidationException;
import com.triageplatform.common.model.DecisionRecord;
import com.triageplatform.common.model.HumanValidation;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Recent decisions awaiting or carrying a human verdict, bounded to
 * {@code triage.review.ledger-capacity} entries; the oldest recorded decision is dropped first.
 */
@Component
public class DecisionLedger {

    private final int capacity;
    private final Map<String, DecisionRecord> decisions;

    public DecisionLedger(@Value("${triage.review.ledger-capacity:1000}") int capacity) {
        if (capacity < 1) {
            throw new ConfigurationException("DecisionLedger",
                "triage.review.ledger-capacity must be >= 1, got " + capacity);
        }
        this.capacity  = capacity;
        this.decisions = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, DecisionRecord> eldest) {
                return size() > DecisionLedger.this.capacity;
            }
        };
    }

    public synchronized void record(DecisionRecord decision) {
        decisions.put(decision.id(), decision);
    }

    public synchronized Optional<DecisionRecord> find(String decisionId) {
        return Optional.ofNullable(decisions.get(decisionId));
    }

    /**
     * Attaches {@code validation} to a decision that has none yet, as one step under the ledger lock.
     *
     * @return the annotated decision
     * @throws ValidationException for an unknown or already validated decision
     */
    public synchronized DecisionRecord annotateIfUnvalidated(HumanValidation validation) {
        String decisionId = validation.decisionId();
        DecisionRecord decision = decisions.get(decisionId);
        if (decision == null) {
            throw new ValidationException("HumanReview", "unknown decision " + decisionId);
        }
        if (decision.isValidated()) {
            throw new ValidationException("HumanReview", "decision " + decisionId + " is already validated");
        }
        DecisionRecord annotated = decision.withValidation(validation);
        decisions.put(decisionId, annotated);
        return annotated;
    }

    public synchronized int size() {
        return decisions.size();
    }
}
