package com.headspace.api.dto;

import lombok.Data;

/**
 * 回合捕获结果 DTO。
 */
@Data
public class TurnCaptureResponseDTO {

    private Long agentId;
    private Long taskId;
    private Long turnId;
    private String outcome;
    private String fromState;
    private String toState;
    private String trigger;
    private String reason;
}
