package com.headspace.domain.turn.adapter.repository;

import com.headspace.domain.turn.model.entity.TurnEntity;
import com.headspace.types.enums.TimestampSourceEnum;
import com.headspace.types.enums.TurnIntentEnum;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 回合仓储接口。不提供删除操作。
 */
public interface ITurnRepository {

    TurnEntity save(TurnEntity entity);

    TurnEntity findById(Long id);

    List<TurnEntity> findByAgentId(Long agentId, int limit);

    /**
     * 查询 Agent 最近的回合：事件时间或最后更新时间不早于 cutoff，按事件时间升序。
     */
    List<TurnEntity> findRecentByAgentId(Long agentId, LocalDateTime cutoff);

    /**
     * 查询 Agent 的全部回合，按事件时间升序。
     */
    List<TurnEntity> findAllByAgentId(Long agentId);

    boolean updateTimestamp(Long turnId,
                            LocalDateTime eventTime,
                            TimestampSourceEnum timestampSource,
                            String entryFingerprint);

    /**
     * 复用已被转录对账写入的回合时，改写为钩子判定的意图。
     */
    boolean updateIntent(Long turnId, TurnIntentEnum intent);
}
