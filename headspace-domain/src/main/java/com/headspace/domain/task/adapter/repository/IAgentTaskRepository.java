package com.headspace.domain.task.adapter.repository;

import com.headspace.domain.task.model.entity.AgentTaskEntity;
import com.headspace.types.enums.TaskStateEnum;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Agent 任务仓储接口。
 */
public interface IAgentTaskRepository {

    AgentTaskEntity save(AgentTaskEntity entity);

    AgentTaskEntity findById(Long id);

    /**
     * 查询 Agent 当前未完成的任务（最多一个）。
     */
    AgentTaskEntity findActiveByAgentId(Long agentId);

    AgentTaskEntity findLatestByAgentId(Long agentId);

    List<AgentTaskEntity> findByAgentId(Long agentId);

    /**
     * 条件更新状态：仅当当前状态等于 expectedState 时生效。
     *
     * @return 是否更新成功
     */
    boolean updateStateIfMatch(Long taskId,
                               TaskStateEnum expectedState,
                               TaskStateEnum targetState,
                               String completionReason,
                               LocalDateTime completedAt);
}
