package com.headspace.test;

import com.headspace.domain.agent.model.entity.AgentEntity;
import com.headspace.domain.monitor.model.entity.MonitorEventEntity;
import com.headspace.domain.transcript.model.valobj.TranscriptEntry;
import com.headspace.domain.turn.model.entity.TurnEntity;
import com.headspace.test.support.MonitorTestFixture;
import com.headspace.trigger.application.command.TranscriptReconcileApplicationService;
import com.headspace.trigger.application.command.TurnCaptureApplicationService;
import com.headspace.trigger.application.command.TurnSignal;
import com.headspace.types.enums.MonitorEventTypeEnum;
import com.headspace.types.enums.TaskStateEnum;
import com.headspace.types.enums.TimestampSourceEnum;
import com.headspace.types.enums.TurnActorEnum;
import com.headspace.types.enums.TurnIntentEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

public class TranscriptReconcileApplicationServiceTest {

    private final MonitorTestFixture fixture = new MonitorTestFixture();

    @Test
    public void shouldCorrectApproximateTimeAndCreateMissedTurn() {
        AgentEntity agent = fixture.registerAgent("r-1");
        LocalDateTime receipt = LocalDateTime.now();
        TurnCaptureApplicationService.TurnCaptureResult captured = fixture.captureService.capture(
                new TurnSignal(agent.getId(), TurnActorEnum.USER, TurnIntentEnum.COMMAND, "fix the flaky test", receipt));
        LocalDateTime typedAt = receipt.minusSeconds(2);
        LocalDateTime answeredAt = receipt.minusSeconds(1);

        TranscriptReconcileApplicationService.ReconciliationResult result = fixture.reconcileService.reconcile(agent.getId(), List.of(
                new TranscriptEntry(TurnActorEnum.USER, "fix the flaky test", typedAt),
                new TranscriptEntry(TurnActorEnum.AGENT, "Fixed: the test now waits for the latch.", answeredAt)));

        Assertions.assertEquals(1, result.updated().size());
        Assertions.assertEquals(1, result.created().size());
        TurnEntity corrected = fixture.turnRepository.findById(captured.turnId());
        Assertions.assertEquals(typedAt, corrected.getEventTime());
        Assertions.assertEquals(TimestampSourceEnum.AUTHORITATIVE, corrected.getTimestampSource());
        Assertions.assertNotNull(corrected.getEntryFingerprint());

        TurnEntity created = fixture.turnRepository.findById(result.created().get(0).getId());
        Assertions.assertEquals(TurnActorEnum.AGENT, created.getActor());
        Assertions.assertEquals(TurnIntentEnum.PROGRESS, created.getIntent());
        Assertions.assertEquals(answeredAt, created.getEventTime());
        Assertions.assertEquals(TimestampSourceEnum.AUTHORITATIVE, created.getTimestampSource());
        Assertions.assertEquals(captured.taskId(), created.getTaskId());

        List<MonitorEventEntity> updates = fixture.eventRepository.ofType(MonitorEventTypeEnum.TURN_UPDATED);
        Assertions.assertEquals(1, updates.size());
        Assertions.assertEquals(receipt.toString(), updates.get(0).getEventData().get("previousEventTime"));
        Assertions.assertEquals(typedAt.toString(), updates.get(0).getEventData().get("eventTime"));
    }

    @Test
    public void shouldBeIdempotentWhenReplayingSameEntries() {
        AgentEntity agent = fixture.registerAgent("r-2");
        LocalDateTime receipt = LocalDateTime.now();
        fixture.captureService.capture(
                new TurnSignal(agent.getId(), TurnActorEnum.USER, TurnIntentEnum.COMMAND, "deploy", receipt));
        List<TranscriptEntry> entries = List.of(
                new TranscriptEntry(TurnActorEnum.USER, "deploy", receipt.minusSeconds(1)),
                new TranscriptEntry(TurnActorEnum.AGENT, "Deployment finished without errors.", receipt));
        fixture.reconcileService.reconcile(agent.getId(), entries);
        int turnsAfterFirstPass = fixture.turnRepository.size();
        int eventsAfterFirstPass = fixture.eventRepository.size();

        TranscriptReconcileApplicationService.ReconciliationResult second =
                fixture.reconcileService.reconcile(agent.getId(), entries);

        Assertions.assertTrue(second.isEmpty());
        Assertions.assertEquals(turnsAfterFirstPass, fixture.turnRepository.size());
        Assertions.assertEquals(eventsAfterFirstPass, fixture.eventRepository.size());
    }

    @Test
    public void shouldCreateRatherThanRewriteAmbiguousAuthoritativeTurn() {
        AgentEntity agent = fixture.registerAgent("r-3");
        LocalDateTime first = LocalDateTime.now().minusSeconds(10);
        fixture.reconcileService.reconcile(agent.getId(),
                List.of(new TranscriptEntry(TurnActorEnum.USER, "continue", first)));

        TranscriptReconcileApplicationService.ReconciliationResult result = fixture.reconcileService.reconcile(agent.getId(),
                List.of(new TranscriptEntry(TurnActorEnum.USER, "continue", first.plusSeconds(5))));

        Assertions.assertTrue(result.updated().isEmpty());
        Assertions.assertEquals(1, result.created().size());
        List<TurnEntity> turns = fixture.turnRepository.findAllByAgentId(agent.getId());
        Assertions.assertEquals(2, turns.size());
        Assertions.assertEquals(first, turns.get(0).getEventTime());
        Assertions.assertEquals(first.plusSeconds(5), turns.get(1).getEventTime());
    }

    @Test
    public void shouldAttachCreatedTurnsToIdleTaskWhenAgentHasNone() {
        AgentEntity agent = fixture.registerAgent("r-4");

        TranscriptReconcileApplicationService.ReconciliationResult result = fixture.reconcileService.reconcile(agent.getId(),
                List.of(new TranscriptEntry(TurnActorEnum.AGENT, "Starting up.", null)));

        TurnEntity created = result.created().get(0);
        Assertions.assertEquals(TimestampSourceEnum.APPROXIMATE, created.getTimestampSource());
        Assertions.assertEquals(TaskStateEnum.IDLE, fixture.taskRepository.findById(created.getTaskId()).getState());
        Assertions.assertTrue(fixture.eventRepository.ofType(MonitorEventTypeEnum.STATE_CHANGED).isEmpty());
    }

    @Test
    public void shouldAdvanceTranscriptPositionWhenReadingFromSource() {
        AgentEntity agent = fixture.registerAgent("r-5");
        LocalDateTime now = LocalDateTime.now();
        fixture.transcriptSource.append(agent.getTranscriptPath(),
                new TranscriptEntry(TurnActorEnum.USER, "list files", now.minusSeconds(3)));
        fixture.transcriptSource.append(agent.getTranscriptPath(),
                new TranscriptEntry(TurnActorEnum.AGENT, "Here are the files in the repository.", now.minusSeconds(2)));

        TranscriptReconcileApplicationService.ReconciliationResult first =
                fixture.reconcileService.reconcileFromSource(agent.getId());
        TranscriptReconcileApplicationService.ReconciliationResult second =
                fixture.reconcileService.reconcileFromSource(agent.getId());

        Assertions.assertEquals(2, first.created().size());
        Assertions.assertTrue(second.isEmpty());
        Assertions.assertEquals(2L, fixture.agentRepository.findById(agent.getId()).getTranscriptPosition());
    }

    @Test
    public void shouldMatchTurnsOutsideWindowDuringFullSessionReconcile() {
        AgentEntity agent = fixture.registerAgent("r-6");
        LocalDateTime longAgo = LocalDateTime.now().minusHours(1);
        fixture.turnRepository.setClock(longAgo);
        fixture.captureService.capture(
                new TurnSignal(agent.getId(), TurnActorEnum.USER, TurnIntentEnum.COMMAND, "old request", longAgo));
        fixture.turnRepository.setClock(null);
        fixture.transcriptSource.append(agent.getTranscriptPath(),
                new TranscriptEntry(TurnActorEnum.USER, "old request", longAgo.minusSeconds(1)));

        TranscriptReconcileApplicationService.ReconciliationResult result =
                fixture.reconcileService.reconcileFullSession(agent.getId());

        Assertions.assertEquals(1, result.updated().size());
        Assertions.assertTrue(result.created().isEmpty());
        Assertions.assertEquals(1, fixture.turnRepository.size());
        Assertions.assertEquals(1L, fixture.agentRepository.findById(agent.getId()).getTranscriptPosition());
    }

    @Test
    public void shouldSkipAgentWithoutTranscript() {
        AgentEntity agent = fixture.sessionService.register("r-7", null, null);

        Assertions.assertTrue(fixture.reconcileService.reconcileFromSource(agent.getId()).isEmpty());
        Assertions.assertTrue(fixture.reconcileService.reconcileFullSession(agent.getId()).isEmpty());
        Assertions.assertEquals(0, fixture.transcriptSource.readCalls());
    }
}
