package com.triageplatform.dedup.config;

import com.triageplatform.common.exception.ConfigurationException;
import com.triageplatform.dedup.model.DeduplicationAction;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Deduplication settings, bound from {@code triage.dedup.*}.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "triage.dedup")
public class DeduplicationProperties {

    public static final String LOCAL_KEY_PREFIX = "dedup_";
    public static final String REDIS_KEY_PREFIX = "triage:dedup:";

    private boolean enabled = true;
    /** {@code local} or {@code redis}. */
    private String mode = "local";
    private Duration ttl = Duration.ofMinutes(30);
    private int maxEntries = 10_000;
    private DeduplicationAction actionOnDuplicate = DeduplicationAction.UPDATE_EXISTING;
    /** Falls back to the variant's own prefix when unset. */
    private String keyPrefix;
    private Duration lockTtl = Duration.ofSeconds(10);

    @PostConstruct
    public void validate() {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new ConfigurationException("Deduplicator", "triage.dedup.ttl must be positive, got " + ttl);
        }
        if (maxEntries < 1) {
            throw new ConfigurationException("Deduplicator",
                "triage.dedup.max-entries must be >= 1, got " + maxEntries);
        }
        if (actionOnDuplicate == null || actionOnDuplicate == DeduplicationAction.NEW) {
            throw new ConfigurationException("Deduplicator",
                "triage.dedup.action-on-duplicate must be UPDATE_EXISTING or SKIP, got " + actionOnDuplicate);
        }
        if (lockTtl == null || lockTtl.isZero() || lockTtl.isNegative()) {
            throw new ConfigurationException("Deduplicator",
                "triage.dedup.lock-ttl must be positive, got " + lockTtl);
        }
    }

    public String keyPrefixOr(String fallback) {
        return keyPrefix == null || keyPrefix.isBlank() ? fallback : keyPrefix;
    }
}
