package com.headspace.domain.transcript.model.valobj;

import com.headspace.domain.turn.model.entity.TurnEntity;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 对账匹配结果：需修正时间戳的回合与需新建的回合。
 */
public record ReconciliationPlan(List<TimestampCorrection> corrections,
                                 List<PlannedTurn> creations,
                                 int unchanged,
                                 int ambiguous,
                                 int ignored) {

    public boolean isEmpty() {
        return corrections.isEmpty() && creations.isEmpty();
    }

    public record TimestampCorrection(TurnEntity turn, LocalDateTime eventTime, String fingerprint) {
    }

    public record PlannedTurn(TranscriptEntry entry, String fingerprint) {
    }
}
