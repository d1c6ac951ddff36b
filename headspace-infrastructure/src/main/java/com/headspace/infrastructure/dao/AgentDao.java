package com.headspace.infrastructure.dao;

import com.headspace.infrastructure.dao.po.AgentPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Agent DAO。
 */
@Mapper
public interface AgentDao {

    int insert(AgentPO po);

    AgentPO selectById(@Param("id") Long id);

    AgentPO selectBySessionUuid(@Param("sessionUuid") String sessionUuid);

    List<AgentPO> selectActive();

    int reactivate(@Param("id") Long id,
                   @Param("transcriptPath") String transcriptPath,
                   @Param("tmuxPaneId") String tmuxPaneId,
                   @Param("now") LocalDateTime now);

    int updateLastSeen(@Param("id") Long id, @Param("lastSeenAt") LocalDateTime lastSeenAt);

    int updateTranscriptPosition(@Param("id") Long id, @Param("position") Long position);

    int updateContextUsage(@Param("id") Long id,
                           @Param("percentUsed") Integer percentUsed,
                           @Param("remainingTokens") String remainingTokens,
                           @Param("updatedAt") LocalDateTime updatedAt);

    int markEndedIfActive(@Param("id") Long id, @Param("endedAt") LocalDateTime endedAt);
}
