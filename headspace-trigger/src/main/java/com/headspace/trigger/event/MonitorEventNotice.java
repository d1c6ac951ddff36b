package com.headspace.trigger.event;

import com.headspace.domain.monitor.model.entity.MonitorEventEntity;
import com.headspace.types.enums.MonitorEventTypeEnum;
import org.apache.commons.lang3.EnumUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * 跨实例通知内容：只携带事件引用，事件本体由接收方按 Agent 回放加载。
 * <p>
 * 文本格式 {@code agentId/eventId/EVENT_TYPE@origin}，origin 放在最后以允许其中出现分隔符。
 * </p>
 */
public record MonitorEventNotice(Long agentId, Long eventId, MonitorEventTypeEnum eventType, String origin) {

    public static MonitorEventNotice of(MonitorEventEntity event, String origin) {
        return new MonitorEventNotice(event.getAgentId(), event.getId(), event.getEventType(), origin);
    }

    public String format() {
        return agentId + "/" + eventId + "/" + eventType.name() + "@" + origin;
    }

    /**
     * 无法识别的通知返回 null。
     */
    public static MonitorEventNotice parse(String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        int at = text.indexOf('@');
        if (at <= 0 || at == text.length() - 1) {
            return null;
        }
        String[] parts = StringUtils.split(text.substring(0, at), '/');
        if (parts.length != 3) {
            return null;
        }
        MonitorEventTypeEnum eventType = EnumUtils.getEnum(MonitorEventTypeEnum.class, parts[2]);
        long agentId = NumberUtils.toLong(parts[0], -1L);
        long eventId = NumberUtils.toLong(parts[1], -1L);
        if (eventType == null || agentId <= 0 || eventId <= 0) {
            return null;
        }
        return new MonitorEventNotice(agentId, eventId, eventType, text.substring(at + 1));
    }

    public boolean isFrom(String instance) {
        return origin.equals(instance);
    }
}
