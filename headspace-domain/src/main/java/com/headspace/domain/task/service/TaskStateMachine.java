package com.headspace.domain.task.service;

import com.headspace.domain.task.model.valobj.TransitionResult;
import com.headspace.types.enums.TaskStateEnum;
import com.headspace.types.enums.TurnActorEnum;
import com.headspace.types.enums.TurnIntentEnum;
import com.headspace.types.exception.InvalidTransitionException;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 任务状态机：按 (状态, 发出方, 意图) 查表校验迁移，纯函数，无副作用。
 * <p>
 * 表外的组合一律拒绝并抛出 {@link InvalidTransitionException}；COMPLETE 为终态。
 * AWAITING_INPUT 下的 user:command 不是合法迁移，而是新任务边界，见 {@link #startsNewTask}。
 * </p>
 */
@Service
public class TaskStateMachine {

    private static final Map<TaskStateEnum, Map<Trigger, TaskStateEnum>> TRANSITIONS = buildTable();

    public TransitionResult transition(TaskStateEnum fromState, TurnActorEnum actor, TurnIntentEnum intent) {
        if (fromState == null || actor == null || intent == null) {
            throw new IllegalArgumentException("State, actor and intent are required");
        }
        Trigger trigger = new Trigger(actor, intent);
        TaskStateEnum target = TRANSITIONS.getOrDefault(fromState, Collections.emptyMap()).get(trigger);
        if (target == null) {
            throw new InvalidTransitionException(fromState, actor, intent, rejectReason(fromState, trigger));
        }
        return TransitionResult.accepted(fromState, target, trigger.code());
    }

    /**
     * 不抛异常的校验版本，供展示与测试使用。
     */
    public TransitionResult validate(TaskStateEnum fromState, TurnActorEnum actor, TurnIntentEnum intent) {
        try {
            return transition(fromState, actor, intent);
        } catch (InvalidTransitionException ex) {
            return TransitionResult.rejected(fromState, ex.getTrigger(), ex.getReason());
        }
    }

    public boolean startsNewTask(TaskStateEnum currentState, TurnActorEnum actor, TurnIntentEnum intent) {
        return currentState == TaskStateEnum.AWAITING_INPUT
                && actor == TurnActorEnum.USER
                && intent == TurnIntentEnum.COMMAND;
    }

    /**
     * 生命周期强制完成（会话结束、回收、被新任务取代），任何非终态均可完成。
     */
    public TransitionResult forceComplete(TaskStateEnum fromState, String reason) {
        if (fromState == null) {
            throw new IllegalArgumentException("State is required");
        }
        if (fromState.isTerminal()) {
            throw new InvalidTransitionException(fromState, null, null,
                    "Task already COMPLETE, cannot complete again (" + reason + ")");
        }
        return TransitionResult.accepted(fromState, TaskStateEnum.COMPLETE, "lifecycle:" + reason);
    }

    public boolean isTerminal(TaskStateEnum state) {
        return state != null && state.isTerminal();
    }

    public Map<String, TaskStateEnum> validTransitionsFrom(TaskStateEnum state) {
        Map<Trigger, TaskStateEnum> row = TRANSITIONS.getOrDefault(state, Collections.emptyMap());
        Map<String, TaskStateEnum> result = new LinkedHashMap<>();
        for (Map.Entry<Trigger, TaskStateEnum> entry : row.entrySet()) {
            result.put(entry.getKey().code(), entry.getValue());
        }
        return result;
    }

    private String rejectReason(TaskStateEnum fromState, Trigger trigger) {
        if (fromState.isTerminal()) {
            return "Task is COMPLETE, no transition allowed for " + trigger.code();
        }
        if (startsNewTask(fromState, trigger.actor(), trigger.intent())) {
            return "user:command while AWAITING_INPUT starts a new task";
        }
        return "No transition from " + fromState + " on " + trigger.code();
    }

    private static Map<TaskStateEnum, Map<Trigger, TaskStateEnum>> buildTable() {
        Map<TaskStateEnum, Map<Trigger, TaskStateEnum>> table = new EnumMap<>(TaskStateEnum.class);

        Map<Trigger, TaskStateEnum> idle = new LinkedHashMap<>();
        idle.put(user(TurnIntentEnum.COMMAND), TaskStateEnum.COMMANDED);
        idle.put(agent(TurnIntentEnum.PROGRESS), TaskStateEnum.PROCESSING);
        idle.put(agent(TurnIntentEnum.QUESTION), TaskStateEnum.AWAITING_INPUT);
        idle.put(agent(TurnIntentEnum.COMPLETION), TaskStateEnum.COMPLETE);
        idle.put(agent(TurnIntentEnum.END_OF_TASK), TaskStateEnum.COMPLETE);
        table.put(TaskStateEnum.IDLE, Collections.unmodifiableMap(idle));

        Map<Trigger, TaskStateEnum> commanded = new LinkedHashMap<>();
        commanded.put(agent(TurnIntentEnum.PROGRESS), TaskStateEnum.PROCESSING);
        commanded.put(agent(TurnIntentEnum.QUESTION), TaskStateEnum.AWAITING_INPUT);
        commanded.put(agent(TurnIntentEnum.COMPLETION), TaskStateEnum.COMPLETE);
        commanded.put(agent(TurnIntentEnum.END_OF_TASK), TaskStateEnum.COMPLETE);
        commanded.put(user(TurnIntentEnum.COMMAND), TaskStateEnum.COMMANDED);
        table.put(TaskStateEnum.COMMANDED, Collections.unmodifiableMap(commanded));

        Map<Trigger, TaskStateEnum> processing = new LinkedHashMap<>();
        processing.put(agent(TurnIntentEnum.PROGRESS), TaskStateEnum.PROCESSING);
        processing.put(agent(TurnIntentEnum.QUESTION), TaskStateEnum.AWAITING_INPUT);
        processing.put(agent(TurnIntentEnum.COMPLETION), TaskStateEnum.COMPLETE);
        processing.put(agent(TurnIntentEnum.END_OF_TASK), TaskStateEnum.COMPLETE);
        processing.put(user(TurnIntentEnum.ANSWER), TaskStateEnum.PROCESSING);
        processing.put(user(TurnIntentEnum.COMMAND), TaskStateEnum.PROCESSING);
        table.put(TaskStateEnum.PROCESSING, Collections.unmodifiableMap(processing));

        Map<Trigger, TaskStateEnum> awaiting = new LinkedHashMap<>();
        awaiting.put(user(TurnIntentEnum.ANSWER), TaskStateEnum.PROCESSING);
        awaiting.put(agent(TurnIntentEnum.QUESTION), TaskStateEnum.AWAITING_INPUT);
        awaiting.put(agent(TurnIntentEnum.PROGRESS), TaskStateEnum.AWAITING_INPUT);
        awaiting.put(agent(TurnIntentEnum.COMPLETION), TaskStateEnum.COMPLETE);
        awaiting.put(agent(TurnIntentEnum.END_OF_TASK), TaskStateEnum.COMPLETE);
        table.put(TaskStateEnum.AWAITING_INPUT, Collections.unmodifiableMap(awaiting));

        table.put(TaskStateEnum.COMPLETE, Collections.emptyMap());
        return Collections.unmodifiableMap(table);
    }

    private static Trigger user(TurnIntentEnum intent) {
        return new Trigger(TurnActorEnum.USER, intent);
    }

    private static Trigger agent(TurnIntentEnum intent) {
        return new Trigger(TurnActorEnum.AGENT, intent);
    }

    private record Trigger(TurnActorEnum actor, TurnIntentEnum intent) {

        private String code() {
            return actor.code() + ":" + intent.code();
        }
    }
}
