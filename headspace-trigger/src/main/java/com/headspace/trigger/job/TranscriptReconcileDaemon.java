package com.headspace.trigger.job;

import com.headspace.domain.agent.adapter.repository.IAgentRepository;
import com.headspace.domain.agent.model.entity.AgentEntity;
import com.headspace.trigger.application.command.TranscriptReconcileApplicationService;
import com.headspace.trigger.application.common.AgentLockSweeper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 转录对账守护进程：定期按读取偏移增量对账所有带日志的活动 Agent。
 */
@Slf4j
@Component
public class TranscriptReconcileDaemon {

    private static final String WORKER_NAME = "transcript-reconciler";

    private final IAgentRepository agentRepository;
    private final TranscriptReconcileApplicationService transcriptReconcileApplicationService;
    private final AgentLockSweeper agentLockSweeper;
    private final Counter skippedBusyCounter;

    public TranscriptReconcileDaemon(IAgentRepository agentRepository,
                                     TranscriptReconcileApplicationService transcriptReconcileApplicationService,
                                     AgentLockSweeper agentLockSweeper) {
        this.agentRepository = agentRepository;
        this.transcriptReconcileApplicationService = transcriptReconcileApplicationService;
        this.agentLockSweeper = agentLockSweeper;
        this.skippedBusyCounter = Counter.builder("headspace.reconcile.skipped.busy.total").register(Metrics.globalRegistry);
    }

    @Scheduled(fixedDelayString = "${reconciler.poll-interval-ms:2000}", scheduler = "daemonScheduler")
    public void reconcileActiveAgents() {
        List<Long> agentIds = new ArrayList<>();
        for (AgentEntity agent : agentRepository.findActive()) {
            if (agent.hasTranscript()) {
                agentIds.add(agent.getId());
            }
        }
        if (agentIds.isEmpty()) {
            return;
        }
        AgentLockSweeper.SweepResult result = agentLockSweeper.sweep(WORKER_NAME, agentIds,
                transcriptReconcileApplicationService::reconcileFromSource);
        skippedBusyCounter.increment(result.skippedBusy());
        if (result.failed() > 0) {
            log.warn("Transcript reconcile pass had failures. checked={}, processed={}, skippedBusy={}, failed={}",
                    result.checked(), result.processed(), result.skippedBusy(), result.failed());
        }
    }
}
