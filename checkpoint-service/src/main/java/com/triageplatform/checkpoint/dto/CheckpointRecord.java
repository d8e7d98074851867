package com.triageplatform.checkpoint.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A stored step as read back from a {@code CheckpointStore}. {@code agentMemory} maps
 * agentId to the snapshot derived from {@code stateBlob.agentOpinions}.
 */
public record CheckpointRecord(
    @JsonProperty("checkpointId")    String checkpointId,
    @JsonProperty("threadId")        String threadId,
    @JsonProperty("stepIndex")       int stepIndex,
    @JsonProperty("stateBlob")       Map<String, Object> stateBlob,
    @JsonProperty("agentMemory")     Map<String, Object> agentMemory,
    @JsonProperty("decisionContext") Map<String, Object> decisionContext,
    @JsonProperty("createdAt")       Instant createdAt
) {
    public CheckpointRecord {
        stateBlob       = copy(stateBlob);
        agentMemory     = copy(agentMemory);
        decisionContext = copy(decisionContext);
    }

    public CheckpointPayload payload() {
        return new CheckpointPayload(stateBlob, decisionContext);
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
