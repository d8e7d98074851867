package com.triageplatform.checkpoint.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/**
 * Logical execution lineage of one alert. Created on the first step and touched
 * by every later one through the upsert in {@code ExecutionThreadRepository}.
 */
@Data
@NoArgsConstructor
@Table("execution_thread")
public class ExecutionThread {

    @Id
    private String threadId;

    private Instant createdAt;

    private Instant updatedAt;
}
