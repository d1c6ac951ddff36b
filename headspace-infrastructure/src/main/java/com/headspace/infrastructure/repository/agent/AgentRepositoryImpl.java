package com.headspace.infrastructure.repository.agent;

import com.headspace.domain.agent.adapter.repository.IAgentRepository;
import com.headspace.domain.agent.model.entity.AgentEntity;
import com.headspace.infrastructure.dao.AgentDao;
import com.headspace.infrastructure.dao.po.AgentPO;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Agent 仓储实现。
 */
@Repository
public class AgentRepositoryImpl implements IAgentRepository {

    private final AgentDao agentDao;

    public AgentRepositoryImpl(AgentDao agentDao) {
        this.agentDao = agentDao;
    }

    @Override
    public AgentEntity save(AgentEntity entity) {
        entity.validate();
        AgentPO po = toPO(entity);
        agentDao.insert(po);
        return findById(po.getId());
    }

    @Override
    public AgentEntity findById(Long id) {
        if (id == null) {
            return null;
        }
        return toEntity(agentDao.selectById(id));
    }

    @Override
    public AgentEntity findBySessionUuid(String sessionUuid) {
        return toEntity(agentDao.selectBySessionUuid(sessionUuid));
    }

    @Override
    public List<AgentEntity> findActive() {
        List<AgentPO> list = agentDao.selectActive();
        if (list == null || list.isEmpty()) {
            return Collections.emptyList();
        }
        return list.stream().map(this::toEntity).collect(Collectors.toList());
    }

    @Override
    public boolean reactivate(Long id, String transcriptPath, String tmuxPaneId, LocalDateTime now) {
        return agentDao.reactivate(id, transcriptPath, tmuxPaneId, now) > 0;
    }

    @Override
    public boolean touchLastSeen(Long id, LocalDateTime lastSeenAt) {
        return agentDao.updateLastSeen(id, lastSeenAt) > 0;
    }

    @Override
    public boolean updateTranscriptPosition(Long id, long position) {
        return agentDao.updateTranscriptPosition(id, position) > 0;
    }

    @Override
    public boolean updateContextUsage(Long id, Integer percentUsed, String remainingTokens, LocalDateTime updatedAt) {
        return agentDao.updateContextUsage(id, percentUsed, remainingTokens, updatedAt) > 0;
    }

    @Override
    public boolean markEnded(Long id, LocalDateTime endedAt) {
        return agentDao.markEndedIfActive(id, endedAt) > 0;
    }

    private AgentEntity toEntity(AgentPO po) {
        if (po == null) {
            return null;
        }
        AgentEntity entity = new AgentEntity();
        entity.setId(po.getId());
        entity.setSessionUuid(po.getSessionUuid());
        entity.setTranscriptPath(po.getTranscriptPath());
        entity.setTranscriptPosition(po.getTranscriptPosition());
        entity.setTmuxPaneId(po.getTmuxPaneId());
        entity.setContextPercentUsed(po.getContextPercentUsed());
        entity.setContextRemainingTokens(po.getContextRemainingTokens());
        entity.setContextUpdatedAt(po.getContextUpdatedAt());
        entity.setStartedAt(po.getStartedAt());
        entity.setLastSeenAt(po.getLastSeenAt());
        entity.setEndedAt(po.getEndedAt());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private AgentPO toPO(AgentEntity entity) {
        return AgentPO.builder()
                .id(entity.getId())
                .sessionUuid(entity.getSessionUuid())
                .transcriptPath(entity.getTranscriptPath())
                .transcriptPosition(entity.getTranscriptPosition())
                .tmuxPaneId(entity.getTmuxPaneId())
                .contextPercentUsed(entity.getContextPercentUsed())
                .contextRemainingTokens(entity.getContextRemainingTokens())
                .contextUpdatedAt(entity.getContextUpdatedAt())
                .startedAt(entity.getStartedAt())
                .lastSeenAt(entity.getLastSeenAt())
                .endedAt(entity.getEndedAt())
                .build();
    }
}
