package com.headspace.domain.monitor.adapter.repository;

import com.headspace.domain.monitor.model.entity.MonitorEventEntity;

import java.util.List;

/**
 * 监控事件仓储接口。
 */
public interface IMonitorEventRepository {

    MonitorEventEntity save(MonitorEventEntity entity);

    List<MonitorEventEntity> findByAgentIdAfterEventId(Long agentId, Long afterEventId, int limit);
}
