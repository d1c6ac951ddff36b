package com.headspace.test.integration;

import com.headspace.Application;
import com.headspace.domain.agent.model.entity.AgentEntity;
import com.headspace.domain.task.adapter.repository.IAgentTaskRepository;
import com.headspace.domain.task.model.entity.AgentTaskEntity;
import com.headspace.domain.transcript.model.valobj.TranscriptEntry;
import com.headspace.domain.turn.adapter.repository.ITurnRepository;
import com.headspace.domain.turn.model.entity.TurnEntity;
import com.headspace.trigger.application.command.AgentSessionApplicationService;
import com.headspace.trigger.application.command.TranscriptReconcileApplicationService;
import com.headspace.trigger.application.command.TurnCaptureApplicationService;
import com.headspace.trigger.application.command.TurnSignal;
import com.headspace.types.enums.TaskStateEnum;
import com.headspace.types.enums.TimestampSourceEnum;
import com.headspace.types.enums.TurnActorEnum;
import com.headspace.types.enums.TurnIntentEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

@SpringBootTest(
        classes = Application.class,
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "spring.task.scheduling.enabled=false"
        }
)
@EnabledIfSystemProperty(named = "it.docker.enabled", matches = "true")
public class TurnCaptureIntegrationTest extends PostgresIntegrationTestSupport {

    @Autowired
    private AgentSessionApplicationService sessionService;

    @Autowired
    private TurnCaptureApplicationService captureService;

    @Autowired
    private TranscriptReconcileApplicationService reconcileService;

    @Autowired
    private IAgentTaskRepository agentTaskRepository;

    @Autowired
    private ITurnRepository turnRepository;

    @Test
    public void shouldOpenSingleTaskUnderConcurrentCaptures() throws Exception {
        AgentEntity agent = sessionService.register("it-concurrent", null, null);
        int workers = 8;
        CountDownLatch ready = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        try {
            List<Future<TurnCaptureApplicationService.TurnCaptureResult>> futures = new ArrayList<>();
            for (int i = 0; i < workers; i++) {
                String text = "command-" + i;
                futures.add(executor.submit(() -> {
                    ready.await();
                    return captureService.capture(new TurnSignal(agent.getId(), TurnActorEnum.USER,
                            TurnIntentEnum.COMMAND, text, LocalDateTime.now()));
                }));
            }
            ready.countDown();
            for (Future<TurnCaptureApplicationService.TurnCaptureResult> future : futures) {
                Assertions.assertTrue(future.get(30, TimeUnit.SECONDS).isApplied());
            }
        } finally {
            executor.shutdownNow();
        }

        Integer openTasks = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM agent_tasks WHERE agent_id = ? AND state <> 'COMPLETE'", Integer.class, agent.getId());
        Integer turns = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM turns WHERE agent_id = ?", Integer.class, agent.getId());
        Assertions.assertEquals(1, openTasks);
        Assertions.assertEquals(workers, turns);
        Assertions.assertEquals(TaskStateEnum.COMMANDED, agentTaskRepository.findActiveByAgentId(agent.getId()).getState());
    }

    @Test
    public void shouldRejectSecondOpenTaskAndApplyConditionalUpdateOnce() {
        AgentEntity agent = sessionService.register("it-conditional", null, null);
        AgentTaskEntity task = agentTaskRepository.save(AgentTaskEntity.open(agent.getId(), "first", LocalDateTime.now()));

        Assertions.assertThrows(DataIntegrityViolationException.class,
                () -> agentTaskRepository.save(AgentTaskEntity.open(agent.getId(), "second", LocalDateTime.now())));

        Assertions.assertTrue(agentTaskRepository.updateStateIfMatch(task.getId(), TaskStateEnum.IDLE,
                TaskStateEnum.COMMANDED, null, null));
        Assertions.assertFalse(agentTaskRepository.updateStateIfMatch(task.getId(), TaskStateEnum.IDLE,
                TaskStateEnum.PROCESSING, null, null));
        Assertions.assertEquals(TaskStateEnum.COMMANDED, agentTaskRepository.findById(task.getId()).getState());
    }

    @Test
    public void shouldPromoteCapturedTurnToTranscriptTime() {
        AgentEntity agent = sessionService.register("it-reconcile", null, null);
        TurnCaptureApplicationService.TurnCaptureResult captured = captureService.capture(new TurnSignal(agent.getId(),
                TurnActorEnum.USER, TurnIntentEnum.COMMAND, "deploy the thing", LocalDateTime.now()));
        LocalDateTime authoritative = LocalDateTime.now().minusSeconds(3).truncatedTo(ChronoUnit.MILLIS);

        TranscriptReconcileApplicationService.ReconciliationResult result = reconcileService.reconcile(agent.getId(),
                List.of(new TranscriptEntry(TurnActorEnum.USER, "deploy the thing", authoritative),
                        new TranscriptEntry(TurnActorEnum.AGENT, "Deploying now.", authoritative.plusSeconds(1))));

        Assertions.assertEquals(1, result.updated().size());
        Assertions.assertEquals(1, result.created().size());
        TurnEntity promoted = turnRepository.findById(captured.turnId());
        Assertions.assertEquals(TimestampSourceEnum.AUTHORITATIVE, promoted.getTimestampSource());
        Assertions.assertEquals(authoritative, promoted.getEventTime());
        Assertions.assertNotNull(promoted.getEntryFingerprint());

        List<TurnEntity> recent = turnRepository.findRecentByAgentId(agent.getId(), LocalDateTime.now().minusSeconds(1));
        Assertions.assertEquals(2, recent.size());
        Assertions.assertEquals(captured.turnId(), recent.get(0).getId());

        TranscriptReconcileApplicationService.ReconciliationResult again = reconcileService.reconcile(agent.getId(),
                List.of(new TranscriptEntry(TurnActorEnum.USER, "deploy the thing", authoritative)));
        Assertions.assertTrue(again.isEmpty());
    }

    @Test
    public void shouldMergeDeferredCompletionIntoReconciledTurn() {
        AgentEntity agent = sessionService.register("it-merge", null, null);
        AgentTaskEntity task = agentTaskRepository.save(AgentTaskEntity.open(agent.getId(), "run the tests", LocalDateTime.now()));
        Assertions.assertTrue(agentTaskRepository.updateStateIfMatch(task.getId(), TaskStateEnum.IDLE,
                TaskStateEnum.PROCESSING, null, null));
        LocalDateTime writtenAt = LocalDateTime.now().minusSeconds(2).truncatedTo(ChronoUnit.MILLIS);
        List<TranscriptEntry> entries = List.of(
                new TranscriptEntry(TurnActorEnum.AGENT, "All done, the tests pass now.", writtenAt));

        TranscriptReconcileApplicationService.ReconciliationResult reconciled = reconcileService.reconcile(agent.getId(), entries);
        Assertions.assertEquals(1, reconciled.created().size());
        Long transcriptTurnId = reconciled.created().get(0).getId();

        TurnCaptureApplicationService.TurnCaptureResult captured = captureService.captureDeferred(new TurnSignal(agent.getId(),
                TurnActorEnum.AGENT, TurnIntentEnum.COMPLETION, "All done, the tests pass now.", LocalDateTime.now()));

        Assertions.assertTrue(captured.isApplied());
        Assertions.assertEquals(transcriptTurnId, captured.turnId());
        Integer turns = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM turns WHERE agent_id = ?", Integer.class, agent.getId());
        Assertions.assertEquals(1, turns);
        TurnEntity merged = turnRepository.findById(transcriptTurnId);
        Assertions.assertEquals(TimestampSourceEnum.AUTHORITATIVE, merged.getTimestampSource());
        Assertions.assertEquals(writtenAt, merged.getEventTime());
        Assertions.assertEquals(TurnIntentEnum.COMPLETION, merged.getIntent());
        Assertions.assertEquals(TaskStateEnum.COMPLETE, agentTaskRepository.findById(task.getId()).getState());

        Assertions.assertTrue(reconcileService.reconcile(agent.getId(), entries).isEmpty());
        Integer afterReplay = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM turns WHERE agent_id = ?", Integer.class, agent.getId());
        Assertions.assertEquals(1, afterReplay);
    }
}
