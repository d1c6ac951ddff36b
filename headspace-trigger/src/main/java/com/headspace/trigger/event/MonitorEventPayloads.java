package com.headspace.trigger.event;

import com.headspace.domain.task.model.entity.AgentTaskEntity;
import com.headspace.domain.task.model.valobj.TransitionResult;
import com.headspace.domain.turn.model.entity.TurnEntity;
import com.headspace.types.enums.TurnIntentEnum;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 广播事件负载组装。
 */
public final class MonitorEventPayloads {

    private MonitorEventPayloads() {
    }

    public static Map<String, Object> turnCreated(TurnEntity turn) {
        Map<String, Object> data = turnBase(turn);
        data.put("intent", turn.getIntent() == null ? null : turn.getIntent().name());
        data.put("text", turn.getText());
        return data;
    }

    public static Map<String, Object> turnUpdated(TurnEntity turn, LocalDateTime previousTime, LocalDateTime correctedTime) {
        Map<String, Object> data = turnBase(turn);
        data.put("update", "timestamp_correction");
        data.put("previousEventTime", previousTime == null ? null : previousTime.toString());
        data.put("eventTime", correctedTime == null ? null : correctedTime.toString());
        return data;
    }

    public static Map<String, Object> turnReused(TurnEntity turn, TurnIntentEnum previousIntent) {
        Map<String, Object> data = turnBase(turn);
        data.put("update", "hook_merged");
        data.put("previousIntent", previousIntent == null ? null : previousIntent.name());
        data.put("intent", turn.getIntent() == null ? null : turn.getIntent().name());
        return data;
    }

    public static Map<String, Object> stateChanged(AgentTaskEntity task, TransitionResult result) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agentId", task.getAgentId());
        data.put("taskId", task.getId());
        data.put("fromState", result.fromState() == null ? null : result.fromState().name());
        data.put("toState", result.toState() == null ? null : result.toState().name());
        data.put("trigger", result.trigger());
        return data;
    }

    private static Map<String, Object> turnBase(TurnEntity turn) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agentId", turn.getAgentId());
        data.put("taskId", turn.getTaskId());
        data.put("turnId", turn.getId());
        data.put("actor", turn.getActor() == null ? null : turn.getActor().name());
        data.put("eventTime", turn.getEventTime() == null ? null : turn.getEventTime().toString());
        data.put("timestampSource", turn.getTimestampSource() == null ? null : turn.getTimestampSource().name());
        return data;
    }
}
