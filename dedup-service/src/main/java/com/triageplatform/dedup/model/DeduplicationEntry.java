package com.triageplatform.dedup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * One logical execution for a dedup key. {@code executionId} and {@code firstSeen} never change;
 * every duplicate produces a copy with a later {@code lastSeen} and a higher count.
 */
public record DeduplicationEntry(
    @JsonProperty("key")             String key,
    @JsonProperty("executionId")     String executionId,
    @JsonProperty("firstSeen")       Instant firstSeen,
    @JsonProperty("lastSeen")        Instant lastSeen,
    @JsonProperty("occurrenceCount") int occurrenceCount,
    @JsonProperty("ttl")             Duration ttl
) {
    public static DeduplicationEntry first(String key, String executionId, Instant now, Duration ttl) {
        return new DeduplicationEntry(key, executionId, now, now, 1, ttl);
    }

    public DeduplicationEntry touch(Instant now) {
        return new DeduplicationEntry(key, executionId, firstSeen, now, occurrenceCount + 1, ttl);
    }

    /** Expiry runs from the last occurrence, so every duplicate refreshes the TTL. */
    @JsonIgnore
    public boolean isExpired(Instant now) {
        return now.isAfter(lastSeen.plus(ttl));
    }
}
