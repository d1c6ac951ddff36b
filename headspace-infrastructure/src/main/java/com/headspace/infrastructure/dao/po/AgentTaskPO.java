package com.headspace.infrastructure.dao.po;

import com.headspace.types.enums.TaskStateEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Agent 任务 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentTaskPO {

    private Long id;
    private Long agentId;
    private TaskStateEnum state;
    private String instruction;
    private String completionReason;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
