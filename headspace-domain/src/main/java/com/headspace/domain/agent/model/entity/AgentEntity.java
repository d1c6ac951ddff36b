package com.headspace.domain.agent.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 受监控的 Agent 会话实体。
 */
@Data
public class AgentEntity {

    private Long id;
    private String sessionUuid;
    private String transcriptPath;
    /** 权威日志已对账到的字节偏移 */
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

    public void validate() {
        if (sessionUuid == null || sessionUuid.trim().isEmpty()) {
            throw new IllegalStateException("Session UUID cannot be empty");
        }
    }

    public boolean isActive() {
        return endedAt == null;
    }

    public boolean hasTranscript() {
        return transcriptPath != null && !transcriptPath.isBlank();
    }

    public boolean hasPane() {
        return tmuxPaneId != null && !tmuxPaneId.isBlank();
    }

    public long transcriptPositionOrZero() {
        return transcriptPosition == null ? 0L : Math.max(transcriptPosition, 0L);
    }

    public static AgentEntity register(String sessionUuid, String transcriptPath, String tmuxPaneId, LocalDateTime now) {
        AgentEntity entity = new AgentEntity();
        entity.setSessionUuid(sessionUuid);
        entity.setTranscriptPath(transcriptPath);
        entity.setTranscriptPosition(0L);
        entity.setTmuxPaneId(tmuxPaneId);
        entity.setStartedAt(now);
        entity.setLastSeenAt(now);
        entity.validate();
        return entity;
    }
}
