package com.headspace.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 前台回合信号请求 DTO。actor/intent 取值为枚举名（大小写不敏感）。
 */
@Data
public class TurnSignalRequestDTO {

    private String actor;
    private String intent;
    private String text;
    private LocalDateTime receiptTime;
    /** 为 true 时不等待文本，异步从转录日志补齐完成回合 */
    private Boolean deferred;
}
