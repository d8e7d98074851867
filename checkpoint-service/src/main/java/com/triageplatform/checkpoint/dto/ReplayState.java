package com.triageplatform.checkpoint.dto;

import java.time.Instant;
import java.util.Map;

/** Everything needed to resume a thread from a given step. */
public record ReplayState(
    String threadId,
    int stepIndex,
    Map<String, Object> stateBlob,
    Map<String, Object> agentMemory,
    Map<String, Object> decisionContext,
    Instant createdAt
) {
    public static ReplayState from(CheckpointRecord record) {
        return new ReplayState(record.threadId(), record.stepIndex(), record.stateBlob(),
            record.agentMemory(), record.decisionContext(), record.createdAt());
    }
}
