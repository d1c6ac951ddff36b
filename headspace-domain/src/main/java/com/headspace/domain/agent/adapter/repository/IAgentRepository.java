package com.headspace.domain.agent.adapter.repository;

import com.headspace.domain.agent.model.entity.AgentEntity;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Agent 仓储接口。
 */
public interface IAgentRepository {

    AgentEntity save(AgentEntity entity);

    AgentEntity findById(Long id);

    AgentEntity findBySessionUuid(String sessionUuid);

    List<AgentEntity> findActive();

    /**
     * 重新打开已结束的会话并更新其转录/面板信息。
     */
    boolean reactivate(Long id, String transcriptPath, String tmuxPaneId, LocalDateTime now);

    boolean touchLastSeen(Long id, LocalDateTime lastSeenAt);

    boolean updateTranscriptPosition(Long id, long position);

    boolean updateContextUsage(Long id, Integer percentUsed, String remainingTokens, LocalDateTime updatedAt);

    /**
     * 标记会话结束，已结束的不重复更新。
     */
    boolean markEnded(Long id, LocalDateTime endedAt);
}
