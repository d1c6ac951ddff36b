package com.headspace.types.enums;

/**
 * 回合发出方。
 */
public enum TurnActorEnum {
    USER,
    AGENT;

    public String code() {
        return name().toLowerCase();
    }
}
