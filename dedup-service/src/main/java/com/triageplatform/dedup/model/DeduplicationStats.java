package com.triageplatform.dedup.model;

import java.time.Duration;

/** Snapshot of the local cache; {@code deduplicationRate} is a percentage. */
public record DeduplicationStats(
    int cacheSize,
    int maxEntries,
    long totalEventsSeen,
    long duplicateEvents,
    double deduplicationRate,
    Duration ttl
) {}
