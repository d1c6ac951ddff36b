package com.headspace.types.exception;

import com.headspace.types.enums.ResponseCode;
import com.headspace.types.enums.TaskStateEnum;
import com.headspace.types.enums.TurnActorEnum;
import com.headspace.types.enums.TurnIntentEnum;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 状态机拒绝的迁移。actor/intent 为空表示生命周期强制完成。
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public class InvalidTransitionException extends AppException {

    private static final long serialVersionUID = -6640871932907514836L;

    private final TaskStateEnum fromState;
    private final TurnActorEnum actor;
    private final TurnIntentEnum intent;
    private final String reason;

    public InvalidTransitionException(TaskStateEnum fromState,
                                      TurnActorEnum actor,
                                      TurnIntentEnum intent,
                                      String reason) {
        super(ResponseCode.INVALID_TRANSITION.getCode(), reason);
        this.fromState = fromState;
        this.actor = actor;
        this.intent = intent;
        this.reason = reason;
    }

    public String getTrigger() {
        if (actor == null || intent == null) {
            return "lifecycle:force_complete";
        }
        return actor.code() + ":" + intent.code();
    }
}
