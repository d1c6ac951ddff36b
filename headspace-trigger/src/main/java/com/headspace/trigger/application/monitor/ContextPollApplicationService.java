package com.headspace.trigger.application.monitor;

import com.headspace.domain.agent.adapter.gateway.IContextUsageSidecar;
import com.headspace.domain.agent.adapter.gateway.IPaneSampler;
import com.headspace.domain.agent.adapter.repository.IAgentRepository;
import com.headspace.domain.agent.model.entity.AgentEntity;
import com.headspace.domain.agent.model.valobj.ContextUsage;
import com.headspace.domain.agent.service.ContextUsageDomainService;
import com.headspace.trigger.application.common.AgentLockSweeper;
import com.headspace.trigger.event.MonitorEventPublisher;
import com.headspace.types.enums.ContextTierEnum;
import com.headspace.types.enums.MonitorEventTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 上下文用量轮询：解析面板状态栏，失败时读旁路文件；等级变化时广播。
 */
@Slf4j
@Service
public class ContextPollApplicationService {

    static final String WORKER_NAME = "context-poller";

    private static final int CAPTURE_LINES = 5;
    private static final Duration SIDECAR_MAX_AGE = Duration.ofMinutes(5);

    private final IAgentRepository agentRepository;
    private final IPaneSampler paneSampler;
    private final IContextUsageSidecar contextUsageSidecar;
    private final ContextUsageDomainService contextUsageDomainService;
    private final AgentLockSweeper agentLockSweeper;
    private final MonitorEventPublisher monitorEventPublisher;
    private final int warningThreshold;
    private final int highThreshold;
    private final Duration debounce;

    private final Map<Long, ContextTierEnum> lastTiers = new ConcurrentHashMap<>();
    private final Map<Long, LocalDateTime> lastPolledAt = new ConcurrentHashMap<>();

    public ContextPollApplicationService(IAgentRepository agentRepository,
                                         IPaneSampler paneSampler,
                                         IContextUsageSidecar contextUsageSidecar,
                                         ContextUsageDomainService contextUsageDomainService,
                                         AgentLockSweeper agentLockSweeper,
                                         MonitorEventPublisher monitorEventPublisher,
                                         @Value("${context-poller.warning-threshold:65}") int warningThreshold,
                                         @Value("${context-poller.high-threshold:75}") int highThreshold,
                                         @Value("${context-poller.debounce-seconds:15}") long debounceSeconds) {
        this.agentRepository = agentRepository;
        this.paneSampler = paneSampler;
        this.contextUsageSidecar = contextUsageSidecar;
        this.contextUsageDomainService = contextUsageDomainService;
        this.agentLockSweeper = agentLockSweeper;
        this.monitorEventPublisher = monitorEventPublisher;
        this.warningThreshold = warningThreshold > 0 ? warningThreshold : 65;
        this.highThreshold = highThreshold > this.warningThreshold ? highThreshold : Math.max(75, this.warningThreshold);
        this.debounce = Duration.ofSeconds(Math.max(debounceSeconds, 0L));
    }

    public AgentLockSweeper.SweepResult pollOnce() {
        return pollOnce(LocalDateTime.now());
    }

    public AgentLockSweeper.SweepResult pollOnce(LocalDateTime now) {
        List<Long> due = new ArrayList<>();
        Set<Long> activeIds = new HashSet<>();
        for (AgentEntity agent : agentRepository.findActive()) {
            activeIds.add(agent.getId());
            if (!agent.hasPane()) {
                continue;
            }
            LocalDateTime last = lastPolledAt.get(agent.getId());
            if (last != null && last.plus(debounce).isAfter(now)) {
                continue;
            }
            due.add(agent.getId());
        }
        lastTiers.keySet().retainAll(activeIds);
        lastPolledAt.keySet().retainAll(activeIds);
        return agentLockSweeper.sweep(WORKER_NAME, due, agentId -> pollLocked(agentId, now));
    }

    public ContextTierEnum currentTier(Long agentId) {
        return agentId == null ? null : lastTiers.get(agentId);
    }

    private void pollLocked(Long agentId, LocalDateTime now) {
        lastPolledAt.put(agentId, now);
        AgentEntity agent = agentRepository.findById(agentId);
        if (agent == null || !agent.isActive() || !agent.hasPane()) {
            return;
        }
        ContextUsage usage = contextUsageDomainService.parse(paneSampler.capturePane(agent.getTmuxPaneId(), CAPTURE_LINES));
        if (usage == null) {
            usage = contextUsageSidecar.read(agent.getTmuxPaneId(), SIDECAR_MAX_AGE);
        }
        if (usage == null) {
            log.debug("Context usage unavailable. agentId={}, paneId={}", agentId, agent.getTmuxPaneId());
            return;
        }
        agentRepository.updateContextUsage(agentId, usage.percentUsed(), usage.remainingTokens(), now);
        ContextTierEnum tier = ContextTierEnum.resolve(usage.percentUsed(), warningThreshold, highThreshold);
        ContextTierEnum previous = lastTiers.put(agentId, tier);
        if (previous == tier) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("agentId", agentId);
        data.put("percentUsed", usage.percentUsed());
        data.put("remainingTokens", usage.remainingTokens());
        data.put("tier", tier.name().toLowerCase());
        data.put("previousTier", previous == null ? null : previous.name().toLowerCase());
        monitorEventPublisher.publishAfterCommit(MonitorEventTypeEnum.CONTEXT_UPDATED, agentId, data);
        log.info("CONTEXT_TIER_CHANGED agentId={}, percentUsed={}, tier={}, previousTier={}",
                agentId, usage.percentUsed(), tier, previous);
    }
}
