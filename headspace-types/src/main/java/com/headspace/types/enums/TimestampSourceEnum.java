package com.headspace.types.enums;

/**
 * 回合时间戳来源：接收时间近似值，或权威日志中的时间。
 */
public enum TimestampSourceEnum {
    APPROXIMATE,
    AUTHORITATIVE
}
