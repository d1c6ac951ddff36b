package com.headspace.test;

import com.headspace.domain.agent.model.entity.AgentEntity;
import com.headspace.domain.monitor.model.entity.MonitorEventEntity;
import com.headspace.domain.task.model.entity.AgentTaskEntity;
import com.headspace.domain.transcript.model.valobj.TranscriptEntry;
import com.headspace.test.support.MonitorTestFixture;
import com.headspace.trigger.application.command.AgentSessionApplicationService;
import com.headspace.trigger.application.command.TurnSignal;
import com.headspace.types.enums.MonitorEventTypeEnum;
import com.headspace.types.enums.ResponseCode;
import com.headspace.types.enums.TaskStateEnum;
import com.headspace.types.enums.TimestampSourceEnum;
import com.headspace.types.enums.TurnActorEnum;
import com.headspace.types.enums.TurnIntentEnum;
import com.headspace.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

public class AgentSessionApplicationServiceTest {

    private final MonitorTestFixture fixture = new MonitorTestFixture();

    @Test
    public void shouldRegisterNewAgentOnce() {
        AgentEntity first = fixture.sessionService.register(" uuid-1 ", "/tmp/a.jsonl", "%1");
        AgentEntity second = fixture.sessionService.register("uuid-1", "/tmp/a.jsonl", "%1");

        Assertions.assertEquals(first.getId(), second.getId());
        Assertions.assertEquals("uuid-1", second.getSessionUuid());
        Assertions.assertTrue(second.isActive());
        Assertions.assertEquals(1, fixture.agentRepository.findActive().size());
    }

    @Test
    public void shouldRejectBlankSessionUuid() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.sessionService.register("  ", null, null));

        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
    }

    @Test
    public void shouldReactivateEndedAgentAndResetPositionOnNewTranscript() {
        AgentEntity agent = fixture.sessionService.register("uuid-2", "/tmp/old.jsonl", "%2");
        fixture.agentRepository.updateTranscriptPosition(agent.getId(), 42L);
        fixture.sessionService.end(agent.getId());

        AgentEntity revived = fixture.sessionService.register("uuid-2", "/tmp/new.jsonl", "%3");

        Assertions.assertEquals(agent.getId(), revived.getId());
        Assertions.assertTrue(revived.isActive());
        Assertions.assertEquals("/tmp/new.jsonl", revived.getTranscriptPath());
        Assertions.assertEquals("%3", revived.getTmuxPaneId());
        Assertions.assertEquals(0L, revived.getTranscriptPosition());
        Assertions.assertEquals(0, fixture.lockBackend.openSessions());
    }

    @Test
    public void shouldReconcileCompleteTaskAndMarkEndedOnSessionEnd() {
        AgentEntity agent = fixture.registerAgent("uuid-3");
        LocalDateTime receipt = LocalDateTime.now();
        fixture.captureService.capture(new TurnSignal(agent.getId(), TurnActorEnum.USER, TurnIntentEnum.COMMAND,
                "write the release notes", receipt));
        fixture.transcriptSource.append(agent.getTranscriptPath(),
                new TranscriptEntry(TurnActorEnum.USER, "write the release notes", receipt.minusSeconds(1)));
        fixture.transcriptSource.append(agent.getTranscriptPath(),
                new TranscriptEntry(TurnActorEnum.AGENT, "Release notes drafted in CHANGELOG.md.", receipt));

        AgentSessionApplicationService.SessionEndResult result = fixture.sessionService.end(agent.getId());

        Assertions.assertTrue(result.ended());
        Assertions.assertEquals(1, result.reconciledUpdated());
        Assertions.assertEquals(1, result.reconciledCreated());
        Assertions.assertNotNull(result.taskCompletion());
        Assertions.assertFalse(fixture.agentRepository.findById(agent.getId()).isActive());
        List<AgentTaskEntity> tasks = fixture.taskRepository.findByAgentId(agent.getId());
        Assertions.assertEquals(1, tasks.size());
        Assertions.assertEquals(TaskStateEnum.COMPLETE, tasks.get(0).getState());
        Assertions.assertEquals(AgentSessionApplicationService.REASON_SESSION_END, tasks.get(0).getCompletionReason());
        Assertions.assertTrue(fixture.turnRepository.findAllByAgentId(agent.getId()).stream()
                .allMatch(turn -> turn.getTimestampSource() == TimestampSourceEnum.AUTHORITATIVE));

        List<MonitorEventEntity> ended = fixture.eventRepository.ofType(MonitorEventTypeEnum.SESSION_ENDED);
        Assertions.assertEquals(1, ended.size());
        Assertions.assertEquals("session_end", ended.get(0).getEventData().get("reason"));
    }

    @Test
    public void shouldTreatSecondEndAsNoop() {
        AgentEntity agent = fixture.registerAgent("uuid-4");
        fixture.sessionService.end(agent.getId());

        AgentSessionApplicationService.SessionEndResult second = fixture.sessionService.end(agent.getId());

        Assertions.assertFalse(second.ended());
        Assertions.assertNull(second.taskCompletion());
        Assertions.assertEquals(1, fixture.eventRepository.ofType(MonitorEventTypeEnum.SESSION_ENDED).size());
    }

    @Test
    public void shouldReportMissingAgentOnEnd() {
        AppException ex = Assertions.assertThrows(AppException.class, () -> fixture.sessionService.end(404L));

        Assertions.assertEquals(ResponseCode.NOT_FOUND.getCode(), ex.getCode());
        Assertions.assertEquals(0, fixture.lockBackend.openSessions());
    }
}
