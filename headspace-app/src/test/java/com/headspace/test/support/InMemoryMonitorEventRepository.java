package com.headspace.test.support;

import com.headspace.domain.monitor.adapter.repository.IMonitorEventRepository;
import com.headspace.domain.monitor.model.entity.MonitorEventEntity;
import com.headspace.types.enums.MonitorEventTypeEnum;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 内存监控事件仓储。
 */
public class InMemoryMonitorEventRepository implements IMonitorEventRepository {

    private final List<MonitorEventEntity> events = new ArrayList<>();
    private long nextId = 1;

    @Override
    public synchronized MonitorEventEntity save(MonitorEventEntity entity) {
        entity.setId(nextId++);
        entity.setCreatedAt(LocalDateTime.now());
        events.add(entity);
        return entity;
    }

    @Override
    public synchronized List<MonitorEventEntity> findByAgentIdAfterEventId(Long agentId, Long afterEventId, int limit) {
        List<MonitorEventEntity> result = new ArrayList<>();
        long after = afterEventId == null ? 0L : afterEventId;
        for (MonitorEventEntity event : events) {
            if (event.getAgentId().equals(agentId) && event.getId() > after) {
                result.add(event);
                if (result.size() >= limit) {
                    break;
                }
            }
        }
        return result;
    }

    public synchronized List<MonitorEventEntity> ofType(MonitorEventTypeEnum type) {
        List<MonitorEventEntity> result = new ArrayList<>();
        for (MonitorEventEntity event : events) {
            if (event.getEventType() == type) {
                result.add(event);
            }
        }
        return result;
    }

    public synchronized int size() {
        return events.size();
    }
}
