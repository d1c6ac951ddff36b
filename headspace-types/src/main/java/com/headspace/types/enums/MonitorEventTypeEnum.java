package com.headspace.types.enums;

/**
 * 监控广播事件类型（SSE 增量流）。
 */
public enum MonitorEventTypeEnum {

    TURN_CREATED("TurnCreated"),
    TURN_UPDATED("TurnUpdated"),
    STATE_CHANGED("StateChanged"),
    SESSION_ENDED("SessionEnded"),
    CONTEXT_UPDATED("ContextUpdated");

    private final String eventName;

    MonitorEventTypeEnum(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}
