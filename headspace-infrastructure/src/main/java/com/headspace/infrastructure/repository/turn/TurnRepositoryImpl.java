package com.headspace.infrastructure.repository.turn;

import com.headspace.domain.turn.adapter.repository.ITurnRepository;
import com.headspace.domain.turn.model.entity.TurnEntity;
import com.headspace.infrastructure.dao.TurnDao;
import com.headspace.infrastructure.dao.po.TurnPO;
import com.headspace.types.enums.TimestampSourceEnum;
import com.headspace.types.enums.TurnIntentEnum;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 回合仓储实现。
 */
@Repository
public class TurnRepositoryImpl implements ITurnRepository {

    private final TurnDao turnDao;

    public TurnRepositoryImpl(TurnDao turnDao) {
        this.turnDao = turnDao;
    }

    @Override
    public TurnEntity save(TurnEntity entity) {
        entity.validate();
        LocalDateTime now = LocalDateTime.now();
        TurnPO po = toPO(entity);
        po.setCreatedAt(now);
        po.setUpdatedAt(now);
        turnDao.insert(po);
        return toEntity(po);
    }

    @Override
    public TurnEntity findById(Long id) {
        if (id == null) {
            return null;
        }
        return toEntity(turnDao.selectById(id));
    }

    @Override
    public List<TurnEntity> findByAgentId(Long agentId, int limit) {
        if (agentId == null || limit <= 0) {
            return Collections.emptyList();
        }
        return toEntities(turnDao.selectLatestByAgentId(agentId, limit));
    }

    @Override
    public List<TurnEntity> findRecentByAgentId(Long agentId, LocalDateTime cutoff) {
        if (agentId == null || cutoff == null) {
            return Collections.emptyList();
        }
        return toEntities(turnDao.selectRecentByAgentId(agentId, cutoff));
    }

    @Override
    public List<TurnEntity> findAllByAgentId(Long agentId) {
        if (agentId == null) {
            return Collections.emptyList();
        }
        return toEntities(turnDao.selectAllByAgentId(agentId));
    }

    @Override
    public boolean updateTimestamp(Long turnId,
                                   LocalDateTime eventTime,
                                   TimestampSourceEnum timestampSource,
                                   String entryFingerprint) {
        if (turnId == null || eventTime == null || timestampSource == null) {
            return false;
        }
        return turnDao.updateTimestamp(turnId, eventTime, timestampSource, entryFingerprint) > 0;
    }

    @Override
    public boolean updateIntent(Long turnId, TurnIntentEnum intent) {
        if (turnId == null || intent == null) {
            return false;
        }
        return turnDao.updateIntent(turnId, intent) > 0;
    }

    private List<TurnEntity> toEntities(List<TurnPO> list) {
        if (list == null || list.isEmpty()) {
            return Collections.emptyList();
        }
        return list.stream().map(this::toEntity).collect(Collectors.toList());
    }

    private TurnEntity toEntity(TurnPO po) {
        if (po == null) {
            return null;
        }
        TurnEntity entity = new TurnEntity();
        entity.setId(po.getId());
        entity.setAgentId(po.getAgentId());
        entity.setTaskId(po.getTaskId());
        entity.setActor(po.getActor());
        entity.setIntent(po.getIntent());
        entity.setText(po.getText());
        entity.setEventTime(po.getEventTime());
        entity.setTimestampSource(po.getTimestampSource());
        entity.setEntryFingerprint(po.getEntryFingerprint());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private TurnPO toPO(TurnEntity entity) {
        return TurnPO.builder()
                .id(entity.getId())
                .agentId(entity.getAgentId())
                .taskId(entity.getTaskId())
                .actor(entity.getActor())
                .intent(entity.getIntent())
                .text(entity.getText())
                .eventTime(entity.getEventTime())
                .timestampSource(entity.getTimestampSource())
                .entryFingerprint(entity.getEntryFingerprint())
                .build();
    }
}
