package com.headspace.domain.turn.model.entity;

import com.headspace.types.enums.TimestampSourceEnum;
import com.headspace.types.enums.TurnActorEnum;
import com.headspace.types.enums.TurnIntentEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 对话回合实体。回合一经写入不会被本子系统删除，只允许修正时间戳。
 */
@Data
public class TurnEntity {

    private Long id;
    private Long agentId;
    private Long taskId;
    private TurnActorEnum actor;
    private TurnIntentEnum intent;
    private String text;
    /** 语义时间：接收时间（近似）或权威日志时间 */
    private LocalDateTime eventTime;
    private TimestampSourceEnum timestampSource;
    private String entryFingerprint;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public void validate() {
        if (agentId == null) {
            throw new IllegalStateException("Agent ID cannot be null");
        }
        if (taskId == null) {
            throw new IllegalStateException("Task ID cannot be null");
        }
        if (actor == null || intent == null) {
            throw new IllegalStateException("Turn actor and intent cannot be null");
        }
        if (text == null) {
            throw new IllegalStateException("Turn text cannot be null");
        }
        if (eventTime == null || timestampSource == null) {
            throw new IllegalStateException("Turn timestamp cannot be null");
        }
    }

    public boolean isAuthoritative() {
        return timestampSource == TimestampSourceEnum.AUTHORITATIVE;
    }

    public static TurnEntity approximate(Long agentId,
                                         Long taskId,
                                         TurnActorEnum actor,
                                         TurnIntentEnum intent,
                                         String text,
                                         LocalDateTime receiptTime) {
        TurnEntity entity = new TurnEntity();
        entity.setAgentId(agentId);
        entity.setTaskId(taskId);
        entity.setActor(actor);
        entity.setIntent(intent);
        entity.setText(text == null ? "" : text);
        entity.setEventTime(receiptTime == null ? LocalDateTime.now() : receiptTime);
        entity.setTimestampSource(TimestampSourceEnum.APPROXIMATE);
        entity.validate();
        return entity;
    }

    /**
     * 由权威日志补建的回合；记录缺失时间时退化为近似时间。
     */
    public static TurnEntity fromTranscript(Long agentId,
                                            Long taskId,
                                            TurnActorEnum actor,
                                            TurnIntentEnum intent,
                                            String text,
                                            LocalDateTime eventTime,
                                            String fingerprint,
                                            LocalDateTime now) {
        TurnEntity entity = approximate(agentId, taskId, actor, intent, text, eventTime == null ? now : eventTime);
        if (eventTime != null) {
            entity.setTimestampSource(TimestampSourceEnum.AUTHORITATIVE);
        }
        entity.setEntryFingerprint(fingerprint);
        return entity;
    }
}
