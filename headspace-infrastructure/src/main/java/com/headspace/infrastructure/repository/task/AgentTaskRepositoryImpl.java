package com.headspace.infrastructure.repository.task;

import com.headspace.domain.task.adapter.repository.IAgentTaskRepository;
import com.headspace.domain.task.model.entity.AgentTaskEntity;
import com.headspace.infrastructure.dao.AgentTaskDao;
import com.headspace.infrastructure.dao.po.AgentTaskPO;
import com.headspace.types.enums.TaskStateEnum;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Agent 任务仓储实现。
 */
@Repository
public class AgentTaskRepositoryImpl implements IAgentTaskRepository {

    private final AgentTaskDao agentTaskDao;

    public AgentTaskRepositoryImpl(AgentTaskDao agentTaskDao) {
        this.agentTaskDao = agentTaskDao;
    }

    @Override
    public AgentTaskEntity save(AgentTaskEntity entity) {
        entity.validate();
        AgentTaskPO po = toPO(entity);
        agentTaskDao.insert(po);
        return findById(po.getId());
    }

    @Override
    public AgentTaskEntity findById(Long id) {
        if (id == null) {
            return null;
        }
        return toEntity(agentTaskDao.selectById(id));
    }

    @Override
    public AgentTaskEntity findActiveByAgentId(Long agentId) {
        return toEntity(agentTaskDao.selectActiveByAgentId(agentId));
    }

    @Override
    public AgentTaskEntity findLatestByAgentId(Long agentId) {
        return toEntity(agentTaskDao.selectLatestByAgentId(agentId));
    }

    @Override
    public List<AgentTaskEntity> findByAgentId(Long agentId) {
        List<AgentTaskPO> list = agentTaskDao.selectByAgentId(agentId);
        if (list == null || list.isEmpty()) {
            return Collections.emptyList();
        }
        return list.stream().map(this::toEntity).collect(Collectors.toList());
    }

    @Override
    public boolean updateStateIfMatch(Long taskId,
                                      TaskStateEnum expectedState,
                                      TaskStateEnum targetState,
                                      String completionReason,
                                      LocalDateTime completedAt) {
        if (taskId == null || expectedState == null || targetState == null) {
            return false;
        }
        return agentTaskDao.updateStateIfMatch(taskId, expectedState, targetState, completionReason, completedAt) > 0;
    }

    private AgentTaskEntity toEntity(AgentTaskPO po) {
        if (po == null) {
            return null;
        }
        AgentTaskEntity entity = new AgentTaskEntity();
        entity.setId(po.getId());
        entity.setAgentId(po.getAgentId());
        entity.setState(po.getState());
        entity.setInstruction(po.getInstruction());
        entity.setCompletionReason(po.getCompletionReason());
        entity.setStartedAt(po.getStartedAt());
        entity.setCompletedAt(po.getCompletedAt());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private AgentTaskPO toPO(AgentTaskEntity entity) {
        return AgentTaskPO.builder()
                .id(entity.getId())
                .agentId(entity.getAgentId())
                .state(entity.getState())
                .instruction(entity.getInstruction())
                .completionReason(entity.getCompletionReason())
                .startedAt(entity.getStartedAt())
                .completedAt(entity.getCompletedAt())
                .build();
    }
}
