package com.triageplatform.checkpoint.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/** Per-agent snapshot attached to a step. */
@Data
@NoArgsConstructor
@Table("agent_memory")
public class AgentMemory {

    @Id
    private Long id;

    private String checkpointId;

    private String agentId;

    private String memoryData;

    private Instant createdAt;
}
