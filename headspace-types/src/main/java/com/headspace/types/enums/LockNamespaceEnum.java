package com.headspace.types.enums;

/**
 * Advisory lock 命名空间，对应 pg_advisory_lock(int4, int4) 的第一个参数。
 */
public enum LockNamespaceEnum {

    AGENT(1);

    private final int code;

    LockNamespaceEnum(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static LockNamespaceEnum fromCode(int code) {
        for (LockNamespaceEnum value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        return null;
    }
}
