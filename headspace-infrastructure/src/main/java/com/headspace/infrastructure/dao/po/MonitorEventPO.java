package com.headspace.infrastructure.dao.po;

import com.headspace.types.enums.MonitorEventTypeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 监控事件 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitorEventPO {

    private Long id;
    private Long agentId;
    private MonitorEventTypeEnum eventType;
    private String eventData;
    private LocalDateTime createdAt;
}
