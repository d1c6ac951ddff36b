package com.headspace.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 回合 DTO。
 */
@Data
public class TurnDTO {

    private Long id;
    private Long agentId;
    private Long taskId;
    private String actor;
    private String intent;
    private String text;
    private LocalDateTime eventTime;
    private String timestampSource;
    private LocalDateTime createdAt;
}
