package com.triageplatform.checkpoint.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/**
 * One immutable orchestration step. {@code (threadId, stepIndex)} is unique;
 * {@code stateBlob} and {@code decisionContext} hold JSON documents.
 */
@Data
@NoArgsConstructor
@Table("execution_step")
public class ExecutionStep {

    @Id
    private Long id;

    private String checkpointId;

    private String threadId;

    private int stepIndex;

    private String stateBlob;

    private String decisionContext;

    private Instant createdAt;
}
