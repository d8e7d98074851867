package com.triageplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-round context handed to the consensus engine and confidence policy.
 *
 * <p>{@code threadId} identifies the checkpoint lineage the round belongs to; a round
 * without a thread id is evaluated but never checkpointed.
 */
public record DecisionContext(
    @JsonProperty("threadId")         String threadId,
    @JsonProperty("traceId")          String traceId,
    @JsonProperty("securityDecision") boolean securityDecision,
    @JsonProperty("attributes")       Map<String, Object> attributes
) {
    public DecisionContext {
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static DecisionContext empty() {
        return new DecisionContext(null, null, false, Map.of());
    }

    public static DecisionContext forThread(String threadId, String traceId, boolean securityDecision) {
        return new DecisionContext(threadId, traceId, securityDecision, Map.of());
    }

    public boolean hasThread() {
        return threadId != null && !threadId.isBlank();
    }

    public DecisionContext withAttributes(Map<String, Object> extra) {
        return new DecisionContext(threadId, traceId, securityDecision, extra);
    }
}
