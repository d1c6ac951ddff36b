package com.headspace.trigger.application.monitor;

import com.google.common.hash.Hashing;
import com.headspace.domain.agent.adapter.gateway.IPaneSampler;
import com.headspace.domain.agent.adapter.repository.IAgentRepository;
import com.headspace.domain.agent.model.entity.AgentEntity;
import com.headspace.domain.agent.service.ContextUsageDomainService;
import com.headspace.domain.turn.adapter.repository.ITurnRepository;
import com.headspace.domain.turn.model.entity.TurnEntity;
import com.headspace.trigger.application.command.TranscriptReconcileApplicationService;
import com.headspace.trigger.application.common.AgentLockSweeper;
import com.headspace.types.enums.TurnActorEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 回合缺口看门狗：面板出现新输出却没有对应的 Agent 回合时，超过阈值即触发单 Agent 对账。
 * <p>
 * 面板哈希与缺口计时只保存在本进程内存中。另按固定间隔做一次全量兜底对账。
 * </p>
 */
@Slf4j
@Service
public class GapWatchdogApplicationService {

    static final String WORKER_GAP = "gap-watchdog";
    static final String WORKER_SAFETY_NET = "gap-watchdog-sweep";

    private static final int MATCH_TAIL_LINES = 3;
    private static final int MATCH_MIN_LINE_LENGTH = 20;
    private static final long RECENT_TURN_SECONDS = 30L;

    private final IAgentRepository agentRepository;
    private final ITurnRepository turnRepository;
    private final IPaneSampler paneSampler;
    private final ContextUsageDomainService contextUsageDomainService;
    private final TranscriptReconcileApplicationService transcriptReconcileApplicationService;
    private final AgentLockSweeper agentLockSweeper;
    private final Duration gapThreshold;
    private final Duration sweepInterval;
    private final int captureLines;

    private final Map<Long, String> lastHashes = new ConcurrentHashMap<>();
    private final Map<Long, LocalDateTime> gapDetectedAt = new ConcurrentHashMap<>();
    private volatile LocalDateTime lastSafetySweepAt;

    public GapWatchdogApplicationService(IAgentRepository agentRepository,
                                         ITurnRepository turnRepository,
                                         IPaneSampler paneSampler,
                                         ContextUsageDomainService contextUsageDomainService,
                                         TranscriptReconcileApplicationService transcriptReconcileApplicationService,
                                         AgentLockSweeper agentLockSweeper,
                                         @Value("${watchdog.gap-threshold-seconds:5}") long gapThresholdSeconds,
                                         @Value("${watchdog.sweep-interval-seconds:60}") long sweepIntervalSeconds,
                                         @Value("${watchdog.capture-lines:20}") int captureLines) {
        this.agentRepository = agentRepository;
        this.turnRepository = turnRepository;
        this.paneSampler = paneSampler;
        this.contextUsageDomainService = contextUsageDomainService;
        this.transcriptReconcileApplicationService = transcriptReconcileApplicationService;
        this.agentLockSweeper = agentLockSweeper;
        this.gapThreshold = Duration.ofSeconds(Math.max(gapThresholdSeconds, 0L));
        this.sweepInterval = Duration.ofSeconds(sweepIntervalSeconds > 0 ? sweepIntervalSeconds : 60L);
        this.captureLines = captureLines > 0 ? captureLines : 20;
    }

    public WatchdogTickResult checkOnce() {
        return checkOnce(LocalDateTime.now());
    }

    public WatchdogTickResult checkOnce(LocalDateTime now) {
        List<AgentEntity> agents = agentRepository.findActive();
        Set<Long> activeIds = new HashSet<>();
        int sampled = 0;
        for (AgentEntity agent : agents) {
            activeIds.add(agent.getId());
            if (!agent.hasPane()) {
                continue;
            }
            if (sample(agent, now)) {
                sampled++;
            }
        }
        lastHashes.keySet().retainAll(activeIds);
        gapDetectedAt.keySet().retainAll(activeIds);

        List<Long> overdue = new ArrayList<>();
        for (Map.Entry<Long, LocalDateTime> entry : gapDetectedAt.entrySet()) {
            if (!entry.getValue().plus(gapThreshold).isAfter(now)) {
                overdue.add(entry.getKey());
            }
        }
        int reconciled = 0;
        for (Long agentId : overdue) {
            log.info("TURN_GAP_DETECTED agentId={}, since={}", agentId, gapDetectedAt.get(agentId));
            AgentLockSweeper.SweepResult result = agentLockSweeper.sweepOne(WORKER_GAP, agentId,
                    transcriptReconcileApplicationService::reconcileFromSource);
            if (result.processed() > 0) {
                gapDetectedAt.remove(agentId);
                reconciled++;
            }
        }

        boolean safetySweep = false;
        if (lastSafetySweepAt == null || !lastSafetySweepAt.plus(sweepInterval).isAfter(now)) {
            lastSafetySweepAt = now;
            safetySweep = true;
            List<Long> withTranscript = new ArrayList<>();
            for (AgentEntity agent : agents) {
                if (agent.hasTranscript()) {
                    withTranscript.add(agent.getId());
                }
            }
            agentLockSweeper.sweep(WORKER_SAFETY_NET, withTranscript, transcriptReconcileApplicationService::reconcileFromSource);
        }
        return new WatchdogTickResult(sampled, gapDetectedAt.size(), reconciled, safetySweep);
    }

    public boolean hasOpenGap(Long agentId) {
        return agentId != null && gapDetectedAt.containsKey(agentId);
    }

    private boolean sample(AgentEntity agent, LocalDateTime now) {
        Long agentId = agent.getId();
        String paneText = paneSampler.capturePane(agent.getTmuxPaneId(), captureLines);
        if (paneText == null) {
            log.debug("Pane unavailable, skipping. agentId={}, paneId={}", agentId, agent.getTmuxPaneId());
            return false;
        }
        String hash = Hashing.sha256().hashString(paneText, StandardCharsets.UTF_8).toString();
        String previous = lastHashes.put(agentId, hash);
        if (previous == null || previous.equals(hash)) {
            return true;
        }
        if (matchesRecentTurn(agentId, paneText, now)) {
            gapDetectedAt.remove(agentId);
        } else {
            gapDetectedAt.putIfAbsent(agentId, now);
        }
        return true;
    }

    private boolean matchesRecentTurn(Long agentId, String paneText, LocalDateTime now) {
        List<String> tailLines = meaningfulTail(contextUsageDomainService.stripAnsi(paneText));
        if (tailLines.isEmpty()) {
            return true;
        }
        List<TurnEntity> recent = turnRepository.findRecentByAgentId(agentId, now.minusSeconds(RECENT_TURN_SECONDS));
        for (TurnEntity turn : recent) {
            if (turn.getActor() != TurnActorEnum.AGENT || turn.getText() == null) {
                continue;
            }
            for (String line : tailLines) {
                if (turn.getText().contains(line)) {
                    return true;
                }
            }
        }
        return false;
    }

    private List<String> meaningfulTail(String paneText) {
        List<String> result = new ArrayList<>();
        String[] lines = paneText.split("\n");
        for (int i = lines.length - 1; i >= 0 && result.size() < MATCH_TAIL_LINES; i--) {
            String line = lines[i].strip();
            if (line.length() > MATCH_MIN_LINE_LENGTH) {
                result.add(line);
            }
        }
        return result;
    }

    public record WatchdogTickResult(int sampled, int openGaps, int reconciled, boolean safetySweep) {
    }
}
