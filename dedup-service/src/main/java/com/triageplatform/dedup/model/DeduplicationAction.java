package com.triageplatform.dedup.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DeduplicationAction {
    /** First occurrence: start a new round. */
    NEW,
    /** Duplicate within TTL: attach to the original execution. */
    UPDATE_EXISTING,
    /** Duplicate to ignore, or another process holds the round lock. */
    SKIP;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
