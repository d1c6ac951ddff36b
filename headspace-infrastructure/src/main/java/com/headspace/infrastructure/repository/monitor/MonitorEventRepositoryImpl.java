package com.headspace.infrastructure.repository.monitor;

import com.headspace.domain.monitor.adapter.repository.IMonitorEventRepository;
import com.headspace.domain.monitor.model.entity.MonitorEventEntity;
import com.headspace.infrastructure.dao.MonitorEventDao;
import com.headspace.infrastructure.dao.po.MonitorEventPO;
import com.headspace.infrastructure.util.JsonCodec;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 监控事件仓储实现。
 */
@Repository
public class MonitorEventRepositoryImpl implements IMonitorEventRepository {

    private final MonitorEventDao monitorEventDao;
    private final JsonCodec jsonCodec;

    public MonitorEventRepositoryImpl(MonitorEventDao monitorEventDao, JsonCodec jsonCodec) {
        this.monitorEventDao = monitorEventDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public MonitorEventEntity save(MonitorEventEntity entity) {
        entity.validate();
        MonitorEventPO po = toPO(entity);
        monitorEventDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public List<MonitorEventEntity> findByAgentIdAfterEventId(Long agentId, Long afterEventId, int limit) {
        if (agentId == null || limit <= 0) {
            return Collections.emptyList();
        }
        long cursor = afterEventId == null ? 0L : Math.max(afterEventId, 0L);
        List<MonitorEventPO> events = monitorEventDao.selectByAgentIdAfterEventId(agentId, cursor, limit);
        if (events == null || events.isEmpty()) {
            return Collections.emptyList();
        }
        return events.stream().map(this::toEntity).collect(Collectors.toList());
    }

    private MonitorEventEntity toEntity(MonitorEventPO po) {
        if (po == null) {
            return null;
        }
        MonitorEventEntity entity = new MonitorEventEntity();
        entity.setId(po.getId());
        entity.setAgentId(po.getAgentId());
        entity.setEventType(po.getEventType());
        entity.setCreatedAt(po.getCreatedAt());
        if (po.getEventData() != null) {
            entity.setEventData(jsonCodec.readObject(po.getEventData()));
        }
        return entity;
    }

    private MonitorEventPO toPO(MonitorEventEntity entity) {
        MonitorEventPO po = MonitorEventPO.builder()
                .id(entity.getId())
                .agentId(entity.getAgentId())
                .eventType(entity.getEventType())
                .createdAt(entity.getCreatedAt())
                .build();
        po.setEventData(jsonCodec.writeEventData(entity.getEventData()));
        return po;
    }
}
