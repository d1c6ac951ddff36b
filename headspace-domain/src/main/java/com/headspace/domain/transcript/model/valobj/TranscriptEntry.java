package com.headspace.domain.transcript.model.valobj;

import com.headspace.types.enums.TurnActorEnum;

import java.time.LocalDateTime;

/**
 * 权威转录日志中的一条记录。eventTime 可能缺失。
 */
public record TranscriptEntry(TurnActorEnum actor, String text, LocalDateTime eventTime) {

    public boolean hasContent() {
        return text != null && !text.isBlank();
    }
}
