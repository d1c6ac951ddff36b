package com.headspace.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Agent PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentPO {

    private Long id;
    private String sessionUuid;
    private String transcriptPath;
    private Long transcriptPosition;
    private String tmuxPaneId;
    private Integer contextPercentUsed;
    private String contextRemainingTokens;
    private LocalDateTime contextUpdatedAt;
    private LocalDateTime startedAt;
    private LocalDateTime lastSeenAt;
    private LocalDateTime endedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
