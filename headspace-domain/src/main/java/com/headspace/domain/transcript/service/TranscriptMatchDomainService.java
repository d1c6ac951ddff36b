package com.headspace.domain.transcript.service;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.headspace.domain.transcript.model.valobj.ReconciliationPlan;
import com.headspace.domain.transcript.model.valobj.TranscriptEntry;
import com.headspace.domain.turn.model.entity.TurnEntity;
import com.headspace.domain.turn.model.valobj.TurnFingerprint;
import com.headspace.types.enums.TurnActorEnum;
import com.headspace.types.enums.TurnIntentEnum;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * 转录对账匹配领域服务：把权威日志记录与窗口内已有回合按内容指纹配对，只做计划不做写入。
 * <p>
 * 每个已有回合最多被消费一次；已是权威时间且时间不同的候选视为歧义，不参与匹配。
 * 没有可用候选的记录一律计划新建，不会被跳过。
 * </p>
 */
@Service
public class TranscriptMatchDomainService {

    public ReconciliationPlan plan(List<TurnEntity> windowTurns, List<TranscriptEntry> entries) {
        ListMultimap<String, TurnEntity> index = buildIndex(windowTurns);
        List<ReconciliationPlan.TimestampCorrection> corrections = new ArrayList<>();
        List<ReconciliationPlan.PlannedTurn> creations = new ArrayList<>();
        int unchanged = 0;
        int ambiguous = 0;
        int ignored = 0;

        if (entries != null) {
            for (TranscriptEntry entry : entries) {
                if (entry == null || entry.actor() == null || !entry.hasContent()) {
                    ignored++;
                    continue;
                }
                String fingerprint = TurnFingerprint.of(entry.actor(), entry.text());
                MatchOutcome outcome = takeCandidate(index.get(fingerprint), entry.eventTime());
                ambiguous += outcome.skippedAmbiguous();
                TurnEntity matched = outcome.turn();
                if (matched == null) {
                    creations.add(new ReconciliationPlan.PlannedTurn(entry, fingerprint));
                    continue;
                }
                if (needsCorrection(matched, entry.eventTime())) {
                    corrections.add(new ReconciliationPlan.TimestampCorrection(matched, entry.eventTime(), fingerprint));
                } else {
                    unchanged++;
                }
            }
        }
        return new ReconciliationPlan(corrections, creations, unchanged, ambiguous, ignored);
    }

    public TurnIntentEnum defaultIntent(TurnActorEnum actor) {
        return actor == TurnActorEnum.USER ? TurnIntentEnum.COMMAND : TurnIntentEnum.PROGRESS;
    }

    private ListMultimap<String, TurnEntity> buildIndex(List<TurnEntity> windowTurns) {
        ListMultimap<String, TurnEntity> index = ArrayListMultimap.create();
        if (windowTurns == null) {
            return index;
        }
        List<TurnEntity> ordered = new ArrayList<>(windowTurns);
        ordered.removeIf(Objects::isNull);
        ordered.sort(Comparator.comparing(TurnEntity::getEventTime, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(TurnEntity::getId, Comparator.nullsLast(Comparator.naturalOrder())));
        for (TurnEntity turn : ordered) {
            if (turn.getActor() == null) {
                continue;
            }
            index.put(TurnFingerprint.of(turn.getActor(), turn.getText()), turn);
        }
        return index;
    }

    private MatchOutcome takeCandidate(List<TurnEntity> candidates, LocalDateTime entryTime) {
        int skipped = 0;
        Iterator<TurnEntity> iterator = candidates.iterator();
        while (iterator.hasNext()) {
            TurnEntity candidate = iterator.next();
            if (isAmbiguous(candidate, entryTime)) {
                skipped++;
                continue;
            }
            iterator.remove();
            return new MatchOutcome(candidate, skipped);
        }
        return new MatchOutcome(null, skipped);
    }

    private boolean isAmbiguous(TurnEntity candidate, LocalDateTime entryTime) {
        return candidate.isAuthoritative()
                && entryTime != null
                && !entryTime.equals(candidate.getEventTime());
    }

    private boolean needsCorrection(TurnEntity turn, LocalDateTime entryTime) {
        if (entryTime == null) {
            return false;
        }
        return !turn.isAuthoritative() || !entryTime.equals(turn.getEventTime());
    }

    private record MatchOutcome(TurnEntity turn, int skippedAmbiguous) {
    }
}
