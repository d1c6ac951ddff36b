package com.headspace.trigger.application.command;

import com.headspace.domain.agent.adapter.repository.IAgentRepository;
import com.headspace.domain.agent.model.entity.AgentEntity;
import com.headspace.domain.lock.model.valobj.LockHandle;
import com.headspace.domain.lock.service.AdvisoryLockManager;
import com.headspace.domain.task.adapter.repository.IAgentTaskRepository;
import com.headspace.domain.task.model.entity.AgentTaskEntity;
import com.headspace.domain.task.model.valobj.TransitionResult;
import com.headspace.domain.task.service.TaskStateMachine;
import com.headspace.domain.turn.adapter.repository.ITurnRepository;
import com.headspace.domain.turn.model.entity.TurnEntity;
import com.headspace.domain.turn.model.valobj.TurnFingerprint;
import com.headspace.trigger.application.common.AgentTaskLifecycleService;
import com.headspace.trigger.event.MonitorEventPayloads;
import com.headspace.trigger.event.MonitorEventPublisher;
import com.headspace.types.enums.LockNamespaceEnum;
import com.headspace.types.enums.MonitorEventTypeEnum;
import com.headspace.types.enums.ResponseCode;
import com.headspace.types.enums.TaskStateEnum;
import com.headspace.types.enums.TurnIntentEnum;
import com.headspace.types.exception.AppException;
import com.headspace.types.exception.InvalidTransitionException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * 前台回合捕获用例：在实体锁内先落库回合，再单独尝试状态迁移。
 * <p>
 * 回合写入与迁移各自提交；迁移被拒绝只丢弃迁移本身，已写入的回合不受影响。
 * 转录对账已为同一任务写入同内容回合时复用该回合，不再新建。
 * </p>
 */
@Slf4j
@Service
public class TurnCaptureApplicationService {

    private final AdvisoryLockManager advisoryLockManager;
    private final IAgentRepository agentRepository;
    private final IAgentTaskRepository agentTaskRepository;
    private final ITurnRepository turnRepository;
    private final TaskStateMachine taskStateMachine;
    private final AgentTaskLifecycleService agentTaskLifecycleService;
    private final MonitorEventPublisher monitorEventPublisher;
    private final Duration foregroundTimeout;
    private final Duration deferredTimeout;
    private final long mergeWindowSeconds;
    private final Counter appliedCounter;
    private final Counter rejectedCounter;
    private final Counter conflictCounter;
    private final Counter mergedCounter;

    public TurnCaptureApplicationService(AdvisoryLockManager advisoryLockManager,
                                         IAgentRepository agentRepository,
                                         IAgentTaskRepository agentTaskRepository,
                                         ITurnRepository turnRepository,
                                         TaskStateMachine taskStateMachine,
                                         AgentTaskLifecycleService agentTaskLifecycleService,
                                         MonitorEventPublisher monitorEventPublisher,
                                         @Value("${advisory-lock.foreground-timeout-ms:15000}") long foregroundTimeoutMs,
                                         @Value("${advisory-lock.deferred-timeout-ms:30000}") long deferredTimeoutMs,
                                         @Value("${reconciler.window-seconds:30}") long mergeWindowSeconds) {
        this.advisoryLockManager = advisoryLockManager;
        this.agentRepository = agentRepository;
        this.agentTaskRepository = agentTaskRepository;
        this.turnRepository = turnRepository;
        this.taskStateMachine = taskStateMachine;
        this.agentTaskLifecycleService = agentTaskLifecycleService;
        this.monitorEventPublisher = monitorEventPublisher;
        this.foregroundTimeout = Duration.ofMillis(foregroundTimeoutMs > 0 ? foregroundTimeoutMs : 15000L);
        this.deferredTimeout = Duration.ofMillis(deferredTimeoutMs > 0 ? deferredTimeoutMs : 30000L);
        this.mergeWindowSeconds = mergeWindowSeconds > 0 ? mergeWindowSeconds : 30L;
        this.appliedCounter = Counter.builder("headspace.turn.capture.applied.total").register(Metrics.globalRegistry);
        this.rejectedCounter = Counter.builder("headspace.turn.capture.rejected.total").register(Metrics.globalRegistry);
        this.conflictCounter = Counter.builder("headspace.turn.capture.conflict.total").register(Metrics.globalRegistry);
        this.mergedCounter = Counter.builder("headspace.turn.capture.merged.total").register(Metrics.globalRegistry);
    }

    public TurnCaptureResult capture(TurnSignal signal) {
        return capture(signal, foregroundTimeout);
    }

    public TurnCaptureResult captureDeferred(TurnSignal signal) {
        return capture(signal, deferredTimeout);
    }

    public TurnCaptureResult capture(TurnSignal signal, Duration lockTimeout) {
        validate(signal);
        try (LockHandle ignored = advisoryLockManager.acquireBlocking(LockNamespaceEnum.AGENT, signal.agentId(), lockTimeout)) {
            return captureLocked(signal);
        }
    }

    private TurnCaptureResult captureLocked(TurnSignal signal) {
        Long agentId = signal.agentId();
        AgentEntity agent = agentRepository.findById(agentId);
        if (agent == null) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "Agent not found: " + agentId);
        }
        if (!agent.isActive()) {
            throw new AppException(ResponseCode.AGENT_ENDED.getCode(), "Agent already ended: " + agentId);
        }
        LocalDateTime now = LocalDateTime.now();
        LocalDateTime receiptTime = signal.receiptTime() == null ? now : signal.receiptTime();
        agentRepository.touchLastSeen(agentId, now);

        AgentTaskEntity task = agentTaskLifecycleService.resolveForSignal(agentId, signal.actor(), signal.intent(),
                signal.text(), now);

        TurnEntity turn = findTranscriptTurn(task.getId(), signal, now);
        if (turn == null) {
            turn = turnRepository.save(TurnEntity.approximate(agentId, task.getId(), signal.actor(),
                    signal.intent(), signal.text(), receiptTime));
            monitorEventPublisher.publishAfterCommit(MonitorEventTypeEnum.TURN_CREATED, agentId,
                    MonitorEventPayloads.turnCreated(turn));
        } else {
            mergeIntoTranscriptTurn(turn, signal.intent());
        }

        TaskStateEnum fromState = task.getState();
        TransitionResult transition;
        try {
            transition = taskStateMachine.transition(fromState, signal.actor(), signal.intent());
        } catch (InvalidTransitionException ex) {
            rejectedCounter.increment();
            log.warn("TRANSITION_REJECTED agentId={}, taskId={}, turnId={}, fromState={}, actor={}, intent={}, reason={}",
                    agentId, task.getId(), turn.getId(), fromState, signal.actor(), signal.intent(), ex.getReason());
            return TurnCaptureResult.rejected(agentId, task.getId(), turn.getId(), fromState, ex.getTrigger(), ex.getReason());
        }

        if (transition.changesState()) {
            TaskStateEnum target = transition.toState();
            boolean updated = agentTaskRepository.updateStateIfMatch(task.getId(), fromState, target,
                    target.isTerminal() ? transition.trigger() : null,
                    target.isTerminal() ? now : null);
            if (!updated) {
                conflictCounter.increment();
                log.warn("TRANSITION_CONFLICT agentId={}, taskId={}, turnId={}, expectedState={}, targetState={}",
                        agentId, task.getId(), turn.getId(), fromState, target);
                return TurnCaptureResult.rejected(agentId, task.getId(), turn.getId(), fromState, transition.trigger(),
                        "Task state changed concurrently, expected " + fromState);
            }
            task.setState(target);
            monitorEventPublisher.publishAfterCommit(MonitorEventTypeEnum.STATE_CHANGED, agentId,
                    MonitorEventPayloads.stateChanged(task, transition));
        }
        appliedCounter.increment();
        log.info("TURN_CAPTURED agentId={}, taskId={}, turnId={}, trigger={}, fromState={}, toState={}",
                agentId, task.getId(), turn.getId(), transition.trigger(), fromState, transition.toState());
        return TurnCaptureResult.applied(agentId, task.getId(), turn.getId(), transition);
    }

    /**
     * 同一任务内、对账窗口中已带转录指纹且内容指纹相同的最近一条回合。
     */
    private TurnEntity findTranscriptTurn(Long taskId, TurnSignal signal, LocalDateTime now) {
        if (StringUtils.isBlank(signal.text())) {
            return null;
        }
        String fingerprint = TurnFingerprint.of(signal.actor(), signal.text());
        List<TurnEntity> recent = turnRepository.findRecentByAgentId(signal.agentId(), now.minusSeconds(mergeWindowSeconds));
        for (int i = recent.size() - 1; i >= 0; i--) {
            TurnEntity candidate = recent.get(i);
            if (candidate.getEntryFingerprint() == null
                    || candidate.getActor() != signal.actor()
                    || !Objects.equals(candidate.getTaskId(), taskId)) {
                continue;
            }
            if (fingerprint.equals(TurnFingerprint.of(candidate.getActor(), candidate.getText()))) {
                return candidate;
            }
        }
        return null;
    }

    // timestamp and source stay as the transcript recorded them
    private void mergeIntoTranscriptTurn(TurnEntity turn, TurnIntentEnum intent) {
        TurnIntentEnum previousIntent = turn.getIntent();
        mergedCounter.increment();
        log.info("TURN_MERGED agentId={}, taskId={}, turnId={}, timestampSource={}, previousIntent={}, intent={}",
                turn.getAgentId(), turn.getTaskId(), turn.getId(), turn.getTimestampSource(), previousIntent, intent);
        if (previousIntent == intent || !turnRepository.updateIntent(turn.getId(), intent)) {
            return;
        }
        turn.setIntent(intent);
        monitorEventPublisher.publishAfterCommit(MonitorEventTypeEnum.TURN_UPDATED, turn.getAgentId(),
                MonitorEventPayloads.turnReused(turn, previousIntent));
    }

    private void validate(TurnSignal signal) {
        if (signal == null || signal.agentId() == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "agentId is required");
        }
        if (signal.actor() == null || signal.intent() == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "actor and intent are required");
        }
    }

    public enum CaptureOutcome {
        APPLIED,
        TRANSITION_REJECTED
    }

    public record TurnCaptureResult(CaptureOutcome outcome,
                                    Long agentId,
                                    Long taskId,
                                    Long turnId,
                                    TaskStateEnum fromState,
                                    TaskStateEnum toState,
                                    String trigger,
                                    String reason) {

        static TurnCaptureResult applied(Long agentId, Long taskId, Long turnId, TransitionResult transition) {
            return new TurnCaptureResult(CaptureOutcome.APPLIED, agentId, taskId, turnId,
                    transition.fromState(), transition.toState(), transition.trigger(), null);
        }

        static TurnCaptureResult rejected(Long agentId,
                                          Long taskId,
                                          Long turnId,
                                          TaskStateEnum fromState,
                                          String trigger,
                                          String reason) {
            return new TurnCaptureResult(CaptureOutcome.TRANSITION_REJECTED, agentId, taskId, turnId,
                    fromState, fromState, trigger, reason);
        }

        public boolean isApplied() {
            return outcome == CaptureOutcome.APPLIED;
        }
    }
}
