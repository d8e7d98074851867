package com.triageplatform.common.confidence;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConfidenceLevel {
    VERY_LOW,
    LOW,
    MEDIUM,
    HIGH,
    VERY_HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Bands: &lt;0.2, &lt;0.4, &lt;0.6, &lt;0.8, else very high. */
    public static ConfidenceLevel of(double score) {
        if (score < 0.2) return VERY_LOW;
        if (score < 0.4) return LOW;
        if (score < 0.6) return MEDIUM;
        if (score < 0.8) return HIGH;
        return VERY_HIGH;
    }
}
