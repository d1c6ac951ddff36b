package com.headspace.trigger.application.command;

import com.headspace.domain.agent.adapter.repository.IAgentRepository;
import com.headspace.domain.agent.model.entity.AgentEntity;
import com.headspace.domain.task.model.entity.AgentTaskEntity;
import com.headspace.domain.transcript.adapter.gateway.ITranscriptSource;
import com.headspace.domain.transcript.model.valobj.ReconciliationPlan;
import com.headspace.domain.transcript.model.valobj.TranscriptChunk;
import com.headspace.domain.transcript.model.valobj.TranscriptEntry;
import com.headspace.domain.transcript.service.TranscriptMatchDomainService;
import com.headspace.domain.turn.adapter.repository.ITurnRepository;
import com.headspace.domain.turn.model.entity.TurnEntity;
import com.headspace.trigger.application.common.AgentTaskLifecycleService;
import com.headspace.trigger.event.MonitorEventPayloads;
import com.headspace.trigger.event.MonitorEventPublisher;
import com.headspace.types.enums.MonitorEventTypeEnum;
import com.headspace.types.enums.TimestampSourceEnum;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 转录对账用例：以权威日志修正近似时间戳，并补建前台漏掉的回合。
 * <p>
 * 调用方必须持有该 Agent 的实体锁；广播在事务提交之后发出。
 * </p>
 */
@Slf4j
@Service
public class TranscriptReconcileApplicationService {

    private static final int FULL_READ_MAX_ROUNDS = 10_000;

    private final IAgentRepository agentRepository;
    private final ITurnRepository turnRepository;
    private final ITranscriptSource transcriptSource;
    private final TranscriptMatchDomainService transcriptMatchDomainService;
    private final AgentTaskLifecycleService agentTaskLifecycleService;
    private final MonitorEventPublisher monitorEventPublisher;
    private final long windowSeconds;
    private final Counter updatedCounter;
    private final Counter createdCounter;
    private final Counter ambiguousCounter;

    public TranscriptReconcileApplicationService(IAgentRepository agentRepository,
                                                 ITurnRepository turnRepository,
                                                 ITranscriptSource transcriptSource,
                                                 TranscriptMatchDomainService transcriptMatchDomainService,
                                                 AgentTaskLifecycleService agentTaskLifecycleService,
                                                 MonitorEventPublisher monitorEventPublisher,
                                                 @Value("${reconciler.window-seconds:30}") long windowSeconds) {
        this.agentRepository = agentRepository;
        this.turnRepository = turnRepository;
        this.transcriptSource = transcriptSource;
        this.transcriptMatchDomainService = transcriptMatchDomainService;
        this.agentTaskLifecycleService = agentTaskLifecycleService;
        this.monitorEventPublisher = monitorEventPublisher;
        this.windowSeconds = windowSeconds > 0 ? windowSeconds : 30L;
        this.updatedCounter = Counter.builder("headspace.reconcile.updated.total").register(Metrics.globalRegistry);
        this.createdCounter = Counter.builder("headspace.reconcile.created.total").register(Metrics.globalRegistry);
        this.ambiguousCounter = Counter.builder("headspace.reconcile.ambiguous.total").register(Metrics.globalRegistry);
    }

    /**
     * 对给定日志记录做一次对账，窗口为最近 windowSeconds 内写入或更新的回合。
     */
    @Transactional(rollbackFor = Exception.class)
    public ReconciliationResult reconcile(Long agentId, List<TranscriptEntry> entries) {
        if (agentId == null || entries == null || entries.isEmpty()) {
            return ReconciliationResult.empty();
        }
        LocalDateTime now = LocalDateTime.now();
        List<TurnEntity> window = turnRepository.findRecentByAgentId(agentId, now.minusSeconds(windowSeconds));
        return apply(agentId, window, entries, now);
    }

    /**
     * 从已持久化的读取偏移开始增量读取日志并对账，偏移在同一事务中推进。
     */
    @Transactional(rollbackFor = Exception.class)
    public ReconciliationResult reconcileFromSource(Long agentId) {
        AgentEntity agent = agentRepository.findById(agentId);
        if (agent == null || !agent.hasTranscript()) {
            return ReconciliationResult.empty();
        }
        long position = agent.transcriptPositionOrZero();
        TranscriptChunk chunk = transcriptSource.readFrom(agent.getTranscriptPath(), position);
        ReconciliationResult result = ReconciliationResult.empty();
        if (!chunk.isEmpty()) {
            LocalDateTime now = LocalDateTime.now();
            List<TurnEntity> window = turnRepository.findRecentByAgentId(agentId, now.minusSeconds(windowSeconds));
            result = apply(agentId, window, chunk.entries(), now);
        }
        if (chunk.nextPosition() != position) {
            agentRepository.updateTranscriptPosition(agentId, chunk.nextPosition());
        }
        return result;
    }

    /**
     * 会话结束前的整段对账：读取完整日志，窗口为该 Agent 的全部回合。
     */
    @Transactional(rollbackFor = Exception.class)
    public ReconciliationResult reconcileFullSession(Long agentId) {
        AgentEntity agent = agentRepository.findById(agentId);
        if (agent == null || !agent.hasTranscript()) {
            return ReconciliationResult.empty();
        }
        List<TranscriptEntry> entries = new ArrayList<>();
        long position = 0L;
        for (int round = 0; round < FULL_READ_MAX_ROUNDS; round++) {
            TranscriptChunk chunk = transcriptSource.readFrom(agent.getTranscriptPath(), position);
            entries.addAll(chunk.entries());
            if (chunk.nextPosition() <= position) {
                break;
            }
            position = chunk.nextPosition();
        }
        ReconciliationResult result = entries.isEmpty()
                ? ReconciliationResult.empty()
                : apply(agentId, turnRepository.findAllByAgentId(agentId), entries, LocalDateTime.now());
        if (position > agent.transcriptPositionOrZero()) {
            agentRepository.updateTranscriptPosition(agentId, position);
        }
        log.info("FULL_RECONCILE agentId={}, entries={}, updated={}, created={}",
                agentId, entries.size(), result.updated().size(), result.created().size());
        return result;
    }

    private ReconciliationResult apply(Long agentId, List<TurnEntity> window, List<TranscriptEntry> entries, LocalDateTime now) {
        ReconciliationPlan plan = transcriptMatchDomainService.plan(window, entries);
        if (plan.ambiguous() > 0) {
            ambiguousCounter.increment(plan.ambiguous());
            log.warn("Reconciliation found ambiguous candidates, creating new turns instead. agentId={}, ambiguous={}",
                    agentId, plan.ambiguous());
        }
        if (plan.isEmpty()) {
            return ReconciliationResult.empty();
        }

        List<TurnEntity> updated = new ArrayList<>();
        for (ReconciliationPlan.TimestampCorrection correction : plan.corrections()) {
            TurnEntity turn = correction.turn();
            LocalDateTime previousTime = turn.getEventTime();
            boolean changed = turnRepository.updateTimestamp(turn.getId(), correction.eventTime(),
                    TimestampSourceEnum.AUTHORITATIVE, correction.fingerprint());
            if (!changed) {
                log.debug("Turn timestamp correction affected no row. agentId={}, turnId={}", agentId, turn.getId());
                continue;
            }
            turn.setEventTime(correction.eventTime());
            turn.setTimestampSource(TimestampSourceEnum.AUTHORITATIVE);
            turn.setEntryFingerprint(correction.fingerprint());
            updated.add(turn);
            monitorEventPublisher.publishAfterCommit(MonitorEventTypeEnum.TURN_UPDATED, agentId,
                    MonitorEventPayloads.turnUpdated(turn, previousTime, correction.eventTime()));
        }

        List<TurnEntity> created = new ArrayList<>();
        if (!plan.creations().isEmpty()) {
            AgentTaskEntity task = agentTaskLifecycleService.resolveForReconcile(agentId, now);
            for (ReconciliationPlan.PlannedTurn planned : plan.creations()) {
                TranscriptEntry entry = planned.entry();
                TurnEntity turn = turnRepository.save(TurnEntity.fromTranscript(agentId, task.getId(), entry.actor(),
                        transcriptMatchDomainService.defaultIntent(entry.actor()), entry.text(), entry.eventTime(),
                        planned.fingerprint(), now));
                created.add(turn);
                monitorEventPublisher.publishAfterCommit(MonitorEventTypeEnum.TURN_CREATED, agentId,
                        MonitorEventPayloads.turnCreated(turn));
            }
        }
        updatedCounter.increment(updated.size());
        createdCounter.increment(created.size());
        log.info("RECONCILED agentId={}, updated={}, created={}, unchanged={}, ambiguous={}",
                agentId, updated.size(), created.size(), plan.unchanged(), plan.ambiguous());
        return new ReconciliationResult(updated, created);
    }

    public record ReconciliationResult(List<TurnEntity> updated, List<TurnEntity> created) {

        public static ReconciliationResult empty() {
            return new ReconciliationResult(Collections.emptyList(), Collections.emptyList());
        }

        public boolean isEmpty() {
            return updated.isEmpty() && created.isEmpty();
        }
    }
}
