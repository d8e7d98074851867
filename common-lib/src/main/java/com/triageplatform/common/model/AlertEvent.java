package com.triageplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.triageplatform.common.exception.ValidationException;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * An incoming observability alert, already normalised by the upstream collector.
 * {@code sourceId} plus the optional discriminators form the deduplication signature.
 */
public record AlertEvent(
    @JsonProperty("sourceId")     String sourceId,
    @JsonProperty("eventType")    String eventType,
    @JsonProperty("sourceSystem") String sourceSystem,
    @JsonProperty("severity")     String severity,
    @JsonProperty("payload")      Map<String, Object> payload,
    @JsonProperty("receivedAt")   Instant receivedAt,
    @JsonProperty("traceId")      String traceId
) {
    public AlertEvent {
        if (sourceId == null || sourceId.isBlank()) {
            throw new ValidationException("AlertEvent", "sourceId is required");
        }
        payload    = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        receivedAt = receivedAt == null ? Instant.now() : receivedAt;
        traceId    = traceId == null || traceId.isBlank() ? UUID.randomUUID().toString() : traceId;
    }

    public static AlertEvent of(String sourceId, String eventType, String sourceSystem,
                                String severity, Map<String, Object> payload) {
        return new AlertEvent(sourceId, eventType, sourceSystem, severity, payload, null, null);
    }

    /** Security alerts boost threat-intel weight during consensus. */
    public boolean isSecurityRelated() {
        return eventType != null && eventType.toLowerCase(Locale.ROOT).contains("security");
    }
}
