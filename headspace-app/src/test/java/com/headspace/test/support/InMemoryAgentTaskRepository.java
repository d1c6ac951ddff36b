package com.headspace.test.support;

import com.headspace.domain.task.adapter.repository.IAgentTaskRepository;
import com.headspace.domain.task.model.entity.AgentTaskEntity;
import com.headspace.types.enums.TaskStateEnum;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存任务仓储，按部分唯一索引的语义拒绝同一 Agent 的第二个未完成任务。
 */
public class InMemoryAgentTaskRepository implements IAgentTaskRepository {

    private final Map<Long, AgentTaskEntity> store = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public synchronized AgentTaskEntity save(AgentTaskEntity entity) {
        if (entity.getId() == null) {
            if (!entity.isComplete() && findOpen(entity.getAgentId()) != null) {
                throw new IllegalStateException("Agent already has an open task: " + entity.getAgentId());
            }
            entity.setId(nextId++);
            entity.setCreatedAt(LocalDateTime.now());
        }
        entity.setUpdatedAt(LocalDateTime.now());
        store.put(entity.getId(), copy(entity));
        return entity;
    }

    @Override
    public synchronized AgentTaskEntity findById(Long id) {
        AgentTaskEntity entity = store.get(id);
        return entity == null ? null : copy(entity);
    }

    @Override
    public synchronized AgentTaskEntity findActiveByAgentId(Long agentId) {
        AgentTaskEntity open = findOpen(agentId);
        return open == null ? null : copy(open);
    }

    @Override
    public synchronized AgentTaskEntity findLatestByAgentId(Long agentId) {
        AgentTaskEntity latest = null;
        for (AgentTaskEntity entity : store.values()) {
            if (entity.getAgentId().equals(agentId)) {
                latest = entity;
            }
        }
        return latest == null ? null : copy(latest);
    }

    @Override
    public synchronized List<AgentTaskEntity> findByAgentId(Long agentId) {
        List<AgentTaskEntity> result = new ArrayList<>();
        for (AgentTaskEntity entity : store.values()) {
            if (entity.getAgentId().equals(agentId)) {
                result.add(copy(entity));
            }
        }
        return result;
    }

    @Override
    public synchronized boolean updateStateIfMatch(Long taskId,
                                                   TaskStateEnum expectedState,
                                                   TaskStateEnum targetState,
                                                   String completionReason,
                                                   LocalDateTime completedAt) {
        AgentTaskEntity entity = store.get(taskId);
        if (entity == null || entity.getState() != expectedState) {
            return false;
        }
        entity.setState(targetState);
        if (completionReason != null) {
            entity.setCompletionReason(completionReason);
        }
        if (completedAt != null) {
            entity.setCompletedAt(completedAt);
        }
        entity.setUpdatedAt(LocalDateTime.now());
        return true;
    }

    private AgentTaskEntity findOpen(Long agentId) {
        AgentTaskEntity open = null;
        for (AgentTaskEntity entity : store.values()) {
            if (entity.getAgentId().equals(agentId) && !entity.isComplete()) {
                open = entity;
            }
        }
        return open;
    }

    private AgentTaskEntity copy(AgentTaskEntity source) {
        AgentTaskEntity target = new AgentTaskEntity();
        target.setId(source.getId());
        target.setAgentId(source.getAgentId());
        target.setState(source.getState());
        target.setInstruction(source.getInstruction());
        target.setCompletionReason(source.getCompletionReason());
        target.setStartedAt(source.getStartedAt());
        target.setCompletedAt(source.getCompletedAt());
        target.setCreatedAt(source.getCreatedAt());
        target.setUpdatedAt(source.getUpdatedAt());
        return target;
    }
}
