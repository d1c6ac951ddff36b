package com.headspace.types.enums;

/**
 * 任务工作状态枚举。
 */
public enum TaskStateEnum {
    IDLE,
    COMMANDED,
    PROCESSING,
    AWAITING_INPUT,
    COMPLETE;

    public boolean isTerminal() {
        return this == COMPLETE;
    }
}
