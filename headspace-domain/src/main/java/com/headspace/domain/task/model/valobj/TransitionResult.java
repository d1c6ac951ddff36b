package com.headspace.domain.task.model.valobj;

import com.headspace.types.enums.TaskStateEnum;

/**
 * 状态迁移校验结果。trigger 形如 "user:command"。
 */
public record TransitionResult(boolean valid,
                               TaskStateEnum fromState,
                               TaskStateEnum toState,
                               String trigger,
                               String reason) {

    public static TransitionResult accepted(TaskStateEnum fromState, TaskStateEnum toState, String trigger) {
        return new TransitionResult(true, fromState, toState, trigger, null);
    }

    public static TransitionResult rejected(TaskStateEnum fromState, String trigger, String reason) {
        return new TransitionResult(false, fromState, fromState, trigger, reason);
    }

    public boolean changesState() {
        return valid && fromState != toState;
    }
}
