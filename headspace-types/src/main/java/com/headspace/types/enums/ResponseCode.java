package com.headspace.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义系统中所有API响应的响应码和对应描述信息。
 * </p>
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 资源不存在 */
    NOT_FOUND("0003", "资源不存在"),

    /** Agent 会话已结束 */
    AGENT_ENDED("0004", "Agent 会话已结束"),

    /** 等待实体锁超时 */
    LOCK_TIMEOUT("1001", "等待实体锁超时"),

    /** 同一线程重复获取实体锁 */
    LOCK_REENTRANCY("1002", "同一线程重复获取实体锁"),

    /** 锁后端异常 */
    LOCK_BACKEND_ERROR("1003", "锁后端异常"),

    /** 非法状态迁移，回合已保存 */
    INVALID_TRANSITION("2001", "非法状态迁移");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
