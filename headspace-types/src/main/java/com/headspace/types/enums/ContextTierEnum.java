package com.headspace.types.enums;

/**
 * 上下文窗口占用等级。
 */
public enum ContextTierEnum {
    NORMAL,
    WARNING,
    HIGH;

    public static ContextTierEnum resolve(int percentUsed, int warningThreshold, int highThreshold) {
        if (percentUsed >= highThreshold) {
            return HIGH;
        }
        if (percentUsed >= warningThreshold) {
            return WARNING;
        }
        return NORMAL;
    }
}
