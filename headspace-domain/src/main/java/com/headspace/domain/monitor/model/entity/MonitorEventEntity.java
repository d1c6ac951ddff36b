package com.headspace.domain.monitor.model.entity;

import com.headspace.types.enums.MonitorEventTypeEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 监控广播事件。
 */
@Data
public class MonitorEventEntity {

    private Long id;
    private Long agentId;
    private MonitorEventTypeEnum eventType;
    private Map<String, Object> eventData;
    private LocalDateTime createdAt;

    public void validate() {
        if (agentId == null) {
            throw new IllegalStateException("Agent ID cannot be null");
        }
        if (eventType == null) {
            throw new IllegalStateException("Event type cannot be null");
        }
    }

    public static MonitorEventEntity create(Long agentId,
                                            MonitorEventTypeEnum eventType,
                                            Map<String, Object> eventData) {
        MonitorEventEntity entity = new MonitorEventEntity();
        entity.setAgentId(agentId);
        entity.setEventType(eventType);
        entity.setEventData(eventData);
        entity.validate();
        return entity;
    }
}
