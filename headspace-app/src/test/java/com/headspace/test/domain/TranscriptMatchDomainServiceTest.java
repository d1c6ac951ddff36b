package com.headspace.test.domain;

import com.headspace.domain.transcript.model.valobj.ReconciliationPlan;
import com.headspace.domain.transcript.model.valobj.TranscriptEntry;
import com.headspace.domain.transcript.service.TranscriptMatchDomainService;
import com.headspace.domain.turn.model.entity.TurnEntity;
import com.headspace.domain.turn.model.valobj.TurnFingerprint;
import com.headspace.types.enums.TimestampSourceEnum;
import com.headspace.types.enums.TurnActorEnum;
import com.headspace.types.enums.TurnIntentEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

public class TranscriptMatchDomainServiceTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2026, 3, 1, 10, 0, 0);

    private final TranscriptMatchDomainService service = new TranscriptMatchDomainService();

    @Test
    public void shouldCorrectApproximateTurnWithAuthoritativeTime() {
        TurnEntity turn = approximateTurn(1L, TurnActorEnum.USER, "fix the login bug", T0.plusSeconds(3));
        TranscriptEntry entry = new TranscriptEntry(TurnActorEnum.USER, "fix the login bug", T0);

        ReconciliationPlan plan = service.plan(List.of(turn), List.of(entry));

        Assertions.assertEquals(1, plan.corrections().size());
        Assertions.assertEquals(T0, plan.corrections().get(0).eventTime());
        Assertions.assertEquals(TurnFingerprint.of(TurnActorEnum.USER, "fix the login bug"),
                plan.corrections().get(0).fingerprint());
        Assertions.assertTrue(plan.creations().isEmpty());
    }

    @Test
    public void shouldMatchOnNormalizedPrefixIgnoringCaseAndOuterWhitespace() {
        TurnEntity turn = approximateTurn(1L, TurnActorEnum.AGENT, "  Done. All Tests Pass\n", T0.plusSeconds(1));
        TranscriptEntry entry = new TranscriptEntry(TurnActorEnum.AGENT, "done. all tests pass", T0);

        ReconciliationPlan plan = service.plan(List.of(turn), List.of(entry));

        Assertions.assertEquals(1, plan.corrections().size());
        Assertions.assertTrue(plan.creations().isEmpty());
    }

    @Test
    public void shouldNotMatchAcrossActors() {
        TurnEntity turn = approximateTurn(1L, TurnActorEnum.USER, "same words", T0);
        TranscriptEntry entry = new TranscriptEntry(TurnActorEnum.AGENT, "same words", T0);

        ReconciliationPlan plan = service.plan(List.of(turn), List.of(entry));

        Assertions.assertTrue(plan.corrections().isEmpty());
        Assertions.assertEquals(1, plan.creations().size());
    }

    @Test
    public void shouldConsumeEachTurnAtMostOnce() {
        TurnEntity first = approximateTurn(1L, TurnActorEnum.USER, "yes", T0.plusSeconds(1));
        TranscriptEntry a = new TranscriptEntry(TurnActorEnum.USER, "yes", T0);
        TranscriptEntry b = new TranscriptEntry(TurnActorEnum.USER, "yes", T0.plusSeconds(5));

        ReconciliationPlan plan = service.plan(List.of(first), List.of(a, b));

        Assertions.assertEquals(1, plan.corrections().size());
        Assertions.assertEquals(1, plan.creations().size());
        Assertions.assertEquals(T0.plusSeconds(5), plan.creations().get(0).entry().eventTime());
    }

    @Test
    public void shouldCreateInsteadOfMatchingAuthoritativeTurnWithDifferentTime() {
        TurnEntity authoritative = approximateTurn(1L, TurnActorEnum.USER, "continue", T0);
        authoritative.setTimestampSource(TimestampSourceEnum.AUTHORITATIVE);
        TranscriptEntry entry = new TranscriptEntry(TurnActorEnum.USER, "continue", T0.plusMinutes(2));

        ReconciliationPlan plan = service.plan(List.of(authoritative), List.of(entry));

        Assertions.assertEquals(1, plan.ambiguous());
        Assertions.assertTrue(plan.corrections().isEmpty());
        Assertions.assertEquals(1, plan.creations().size());
    }

    @Test
    public void shouldTreatAlreadyReconciledTurnAsUnchanged() {
        TurnEntity authoritative = approximateTurn(1L, TurnActorEnum.AGENT, "finished refactor", T0);
        authoritative.setTimestampSource(TimestampSourceEnum.AUTHORITATIVE);
        TranscriptEntry entry = new TranscriptEntry(TurnActorEnum.AGENT, "finished refactor", T0);

        ReconciliationPlan plan = service.plan(List.of(authoritative), List.of(entry));

        Assertions.assertTrue(plan.isEmpty());
        Assertions.assertEquals(1, plan.unchanged());
    }

    @Test
    public void shouldIgnoreEntriesWithoutContentAndLeaveTimeWhenEntryHasNone() {
        TurnEntity turn = approximateTurn(1L, TurnActorEnum.USER, "run it", T0);
        TranscriptEntry blank = new TranscriptEntry(TurnActorEnum.USER, "   ", T0);
        TranscriptEntry untimed = new TranscriptEntry(TurnActorEnum.USER, "run it", null);

        ReconciliationPlan plan = service.plan(List.of(turn), List.of(blank, untimed));

        Assertions.assertEquals(1, plan.ignored());
        Assertions.assertEquals(1, plan.unchanged());
        Assertions.assertTrue(plan.isEmpty());
    }

    @Test
    public void shouldPreferEarliestCandidateForDuplicates() {
        TurnEntity later = approximateTurn(2L, TurnActorEnum.USER, "ok", T0.plusSeconds(20));
        TurnEntity earlier = approximateTurn(1L, TurnActorEnum.USER, "ok", T0.plusSeconds(2));
        TranscriptEntry entry = new TranscriptEntry(TurnActorEnum.USER, "ok", T0);

        ReconciliationPlan plan = service.plan(List.of(later, earlier), List.of(entry));

        Assertions.assertEquals(1L, plan.corrections().get(0).turn().getId());
    }

    @Test
    public void shouldDeriveDefaultIntentFromActor() {
        Assertions.assertEquals(TurnIntentEnum.COMMAND, service.defaultIntent(TurnActorEnum.USER));
        Assertions.assertEquals(TurnIntentEnum.PROGRESS, service.defaultIntent(TurnActorEnum.AGENT));
    }

    private TurnEntity approximateTurn(Long id, TurnActorEnum actor, String text, LocalDateTime eventTime) {
        TurnEntity turn = TurnEntity.approximate(100L, 10L, actor,
                actor == TurnActorEnum.USER ? TurnIntentEnum.COMMAND : TurnIntentEnum.PROGRESS, text, eventTime);
        turn.setId(id);
        return turn;
    }
}
