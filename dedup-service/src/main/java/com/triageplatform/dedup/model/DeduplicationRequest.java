package com.triageplatform.dedup.model;

import com.triageplatform.common.exception.ValidationException;
import com.triageplatform.common.model.AlertEvent;

/**
 * Signature of a source event. Only {@code sourceId} is mandatory; absent discriminators
 * are left out of the key.
 */
public record DeduplicationRequest(String sourceId, String eventType, String sourceSystem, String severity) {

    public DeduplicationRequest {
        if (sourceId == null || sourceId.isBlank()) {
            throw new ValidationException("Deduplicator", "sourceId is required");
        }
    }

    public static DeduplicationRequest of(String sourceId) {
        return new DeduplicationRequest(sourceId, null, null, null);
    }

    public static DeduplicationRequest from(AlertEvent event) {
        return new DeduplicationRequest(event.sourceId(), event.eventType(), event.sourceSystem(), event.severity());
    }
}
