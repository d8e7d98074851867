package com.triageplatform.checkpoint.config;

import com.triageplatform.common.exception.ConfigurationException;
import com.triageplatform.common.retry.RetryPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Checkpoint settings, bound from {@code triage.checkpoint.*}.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "triage.checkpoint")
public class CheckpointProperties {

    /** {@code r2dbc} or {@code memory}. */
    private String store = "r2dbc";
    private int keepLast = 10;
    private Retry retry = new Retry();

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private double backoffFactor = 2.0;
    }

    /** @throws ConfigurationException for invalid retry settings */
    public RetryPolicy toRetryPolicy() {
        return new RetryPolicy(retry.getMaxAttempts(), retry.getInitialDelay(), retry.getBackoffFactor());
    }
}
