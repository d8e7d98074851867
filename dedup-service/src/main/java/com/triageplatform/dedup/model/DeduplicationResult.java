package com.triageplatform.dedup.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Answer of a dedup check. {@code executionId} is the original execution on a duplicate,
 * the new one on {@link DeduplicationAction#NEW}, and {@code null} on a lock-contention skip.
 */
public record DeduplicationResult(
    @JsonProperty("action")          DeduplicationAction action,
    @JsonProperty("key")             String key,
    @JsonProperty("executionId")     String executionId,
    @JsonProperty("occurrenceCount") int occurrenceCount
) {
    public static DeduplicationResult fresh(String key, String executionId) {
        return new DeduplicationResult(DeduplicationAction.NEW, key, executionId, 1);
    }

    public static DeduplicationResult duplicate(DeduplicationAction action, DeduplicationEntry entry) {
        return new DeduplicationResult(action, entry.key(), entry.executionId(), entry.occurrenceCount());
    }

    public boolean isNew() {
        return action == DeduplicationAction.NEW;
    }
}
