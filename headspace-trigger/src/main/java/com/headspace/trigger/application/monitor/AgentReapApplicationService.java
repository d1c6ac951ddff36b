package com.headspace.trigger.application.monitor;

import com.headspace.domain.agent.adapter.gateway.IPaneSampler;
import com.headspace.domain.agent.adapter.repository.IAgentRepository;
import com.headspace.domain.agent.model.entity.AgentEntity;
import com.headspace.trigger.application.command.AgentSessionApplicationService;
import com.headspace.trigger.application.common.AgentLockSweeper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 不活跃会话回收：宽限期内不处理；面板仍存活则刷新心跳；否则结束会话。
 */
@Slf4j
@Service
public class AgentReapApplicationService {

    static final String WORKER_NAME = "agent-reaper";
    static final String REASON_INACTIVITY = "inactivity_timeout";

    private final IAgentRepository agentRepository;
    private final IPaneSampler paneSampler;
    private final AgentSessionApplicationService agentSessionApplicationService;
    private final AgentLockSweeper agentLockSweeper;
    private final Duration inactivityTimeout;
    private final Duration gracePeriod;
    private final Counter reapedCounter;

    public AgentReapApplicationService(IAgentRepository agentRepository,
                                       IPaneSampler paneSampler,
                                       AgentSessionApplicationService agentSessionApplicationService,
                                       AgentLockSweeper agentLockSweeper,
                                       @Value("${reaper.inactivity-timeout-seconds:300}") long inactivityTimeoutSeconds,
                                       @Value("${reaper.grace-period-seconds:300}") long gracePeriodSeconds) {
        this.agentRepository = agentRepository;
        this.paneSampler = paneSampler;
        this.agentSessionApplicationService = agentSessionApplicationService;
        this.agentLockSweeper = agentLockSweeper;
        this.inactivityTimeout = Duration.ofSeconds(inactivityTimeoutSeconds > 0 ? inactivityTimeoutSeconds : 300L);
        this.gracePeriod = Duration.ofSeconds(Math.max(gracePeriodSeconds, 0L));
        this.reapedCounter = Counter.builder("headspace.agent.reaped.total").register(Metrics.globalRegistry);
    }

    public ReapResult reapOnce() {
        return reapOnce(LocalDateTime.now());
    }

    public ReapResult reapOnce(LocalDateTime now) {
        List<Long> candidates = new ArrayList<>();
        int skippedGrace = 0;
        for (AgentEntity agent : agentRepository.findActive()) {
            if (agent.getStartedAt() != null && agent.getStartedAt().plus(gracePeriod).isAfter(now)) {
                skippedGrace++;
                continue;
            }
            candidates.add(agent.getId());
        }
        AtomicInteger alive = new AtomicInteger();
        AtomicInteger reaped = new AtomicInteger();
        AgentLockSweeper.SweepResult sweep = agentLockSweeper.sweep(WORKER_NAME, candidates, agentId -> {
            Outcome outcome = reapLocked(agentId, now);
            if (outcome == Outcome.ALIVE) {
                alive.incrementAndGet();
            } else if (outcome == Outcome.REAPED) {
                reaped.incrementAndGet();
            }
        });
        if (reaped.get() > 0) {
            log.info("REAPER_PASS checked={}, reaped={}, alive={}, skippedGrace={}, skippedBusy={}, failed={}",
                    sweep.checked(), reaped.get(), alive.get(), skippedGrace, sweep.skippedBusy(), sweep.failed());
        }
        return new ReapResult(sweep.checked(), reaped.get(), alive.get(), skippedGrace, sweep.skippedBusy(), sweep.failed());
    }

    private Outcome reapLocked(Long agentId, LocalDateTime now) {
        // re-read under the lock, a hook may have touched it since the listing
        AgentEntity agent = agentRepository.findById(agentId);
        if (agent == null || !agent.isActive()) {
            return Outcome.SKIPPED;
        }
        if (agent.getLastSeenAt() != null && agent.getLastSeenAt().plus(inactivityTimeout).isAfter(now)) {
            return Outcome.ALIVE;
        }
        if (agent.hasPane() && paneSampler.isPaneAlive(agent.getTmuxPaneId())) {
            agentRepository.touchLastSeen(agentId, now);
            log.debug("Agent pane alive, refreshed last seen. agentId={}, paneId={}", agentId, agent.getTmuxPaneId());
            return Outcome.ALIVE;
        }
        agentSessionApplicationService.endLocked(agent, "reaper:" + REASON_INACTIVITY);
        reapedCounter.increment();
        log.info("AGENT_REAPED agentId={}, lastSeenAt={}, reason={}", agentId, agent.getLastSeenAt(), REASON_INACTIVITY);
        return Outcome.REAPED;
    }

    private enum Outcome {
        SKIPPED,
        ALIVE,
        REAPED
    }

    public record ReapResult(int checked, int reaped, int alive, int skippedGrace, int skippedBusy, int failed) {
    }
}
