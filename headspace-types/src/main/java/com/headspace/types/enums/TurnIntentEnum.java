package com.headspace.types.enums;

/**
 * 回合意图。
 */
public enum TurnIntentEnum {
    COMMAND,
    ANSWER,
    QUESTION,
    COMPLETION,
    PROGRESS,
    END_OF_TASK;

    public String code() {
        return name().toLowerCase();
    }
}
