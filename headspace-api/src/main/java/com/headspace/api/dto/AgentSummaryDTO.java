package com.headspace.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * Agent 概要 DTO。
 */
@Data
public class AgentSummaryDTO {

    private Long id;
    private String sessionUuid;
    private String transcriptPath;
    private String tmuxPaneId;
    private Integer contextPercentUsed;
    private String contextRemainingTokens;
    private LocalDateTime startedAt;
    private LocalDateTime lastSeenAt;
    private LocalDateTime endedAt;
    private Long activeTaskId;
    private String activeTaskState;
}
