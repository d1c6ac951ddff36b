package com.headspace.domain.task.model.entity;

import com.headspace.types.enums.TaskStateEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Agent 工作任务实体。COMPLETE 后不可变。
 */
@Data
public class AgentTaskEntity {

    private Long id;
    private Long agentId;
    private TaskStateEnum state;
    private String instruction;
    private String completionReason;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public void validate() {
        if (agentId == null) {
            throw new IllegalStateException("Agent ID cannot be null");
        }
        if (state == null) {
            throw new IllegalStateException("Task state cannot be null");
        }
    }

    public boolean isComplete() {
        return state == TaskStateEnum.COMPLETE;
    }

    public static AgentTaskEntity open(Long agentId, String instruction, LocalDateTime startedAt) {
        AgentTaskEntity entity = new AgentTaskEntity();
        entity.setAgentId(agentId);
        entity.setState(TaskStateEnum.IDLE);
        entity.setInstruction(instruction);
        entity.setStartedAt(startedAt == null ? LocalDateTime.now() : startedAt);
        entity.validate();
        return entity;
    }
}
