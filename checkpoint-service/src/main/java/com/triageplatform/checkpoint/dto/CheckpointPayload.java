package com.triageplatform.checkpoint.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a caller hands to {@code persistStep}: the orchestration state and the decision
 * context it was produced in. Both must be JSON-serialisable.
 */
public record CheckpointPayload(
    @JsonProperty("stateBlob")       Map<String, Object> stateBlob,
    @JsonProperty("decisionContext") Map<String, Object> decisionContext
) {
    public CheckpointPayload {
        stateBlob       = copy(stateBlob);
        decisionContext = copy(decisionContext);
    }

    public static CheckpointPayload of(Map<String, Object> stateBlob) {
        return new CheckpointPayload(stateBlob, Map.of());
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
