package com.headspace.trigger.application.command;

import com.headspace.domain.agent.adapter.repository.IAgentRepository;
import com.headspace.domain.agent.model.entity.AgentEntity;
import com.headspace.domain.lock.model.valobj.LockHandle;
import com.headspace.domain.lock.service.AdvisoryLockManager;
import com.headspace.domain.task.model.valobj.TransitionResult;
import com.headspace.trigger.application.common.AgentTaskLifecycleService;
import com.headspace.trigger.event.MonitorEventPublisher;
import com.headspace.types.enums.LockNamespaceEnum;
import com.headspace.types.enums.MonitorEventTypeEnum;
import com.headspace.types.enums.ResponseCode;
import com.headspace.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 会话生命周期用例：注册（新建或复活）与结束。
 */
@Slf4j
@Service
public class AgentSessionApplicationService {

    public static final String REASON_SESSION_END = "session_end";

    private final AdvisoryLockManager advisoryLockManager;
    private final IAgentRepository agentRepository;
    private final AgentTaskLifecycleService agentTaskLifecycleService;
    private final TranscriptReconcileApplicationService transcriptReconcileApplicationService;
    private final MonitorEventPublisher monitorEventPublisher;
    private final Duration foregroundTimeout;

    public AgentSessionApplicationService(AdvisoryLockManager advisoryLockManager,
                                          IAgentRepository agentRepository,
                                          AgentTaskLifecycleService agentTaskLifecycleService,
                                          TranscriptReconcileApplicationService transcriptReconcileApplicationService,
                                          MonitorEventPublisher monitorEventPublisher,
                                          @Value("${advisory-lock.foreground-timeout-ms:15000}") long foregroundTimeoutMs) {
        this.advisoryLockManager = advisoryLockManager;
        this.agentRepository = agentRepository;
        this.agentTaskLifecycleService = agentTaskLifecycleService;
        this.transcriptReconcileApplicationService = transcriptReconcileApplicationService;
        this.monitorEventPublisher = monitorEventPublisher;
        this.foregroundTimeout = Duration.ofMillis(foregroundTimeoutMs > 0 ? foregroundTimeoutMs : 15000L);
    }

    public AgentEntity register(String sessionUuid, String transcriptPath, String tmuxPaneId) {
        if (StringUtils.isBlank(sessionUuid)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "sessionUuid is required");
        }
        String uuid = sessionUuid.trim();
        String path = StringUtils.trimToNull(transcriptPath);
        String pane = StringUtils.trimToNull(tmuxPaneId);
        AgentEntity existing = agentRepository.findBySessionUuid(uuid);
        if (existing == null) {
            try {
                AgentEntity created = agentRepository.save(AgentEntity.register(uuid, path, pane, LocalDateTime.now()));
                log.info("AGENT_REGISTERED agentId={}, sessionUuid={}, paneId={}", created.getId(), uuid, pane);
                return created;
            } catch (DuplicateKeyException ex) {
                log.info("Agent registered concurrently, reusing. sessionUuid={}", uuid);
                existing = agentRepository.findBySessionUuid(uuid);
                if (existing == null) {
                    throw ex;
                }
            }
        }
        try (LockHandle ignored = advisoryLockManager.acquireBlocking(LockNamespaceEnum.AGENT, existing.getId(), foregroundTimeout)) {
            agentRepository.reactivate(existing.getId(), path, pane, LocalDateTime.now());
        }
        log.info("AGENT_REACTIVATED agentId={}, sessionUuid={}, wasEnded={}", existing.getId(), uuid, !existing.isActive());
        return agentRepository.findById(existing.getId());
    }

    /**
     * 前台结束会话：阻塞取锁后执行结束流程。
     */
    public SessionEndResult end(Long agentId) {
        if (agentId == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "agentId is required");
        }
        try (LockHandle ignored = advisoryLockManager.acquireBlocking(LockNamespaceEnum.AGENT, agentId, foregroundTimeout)) {
            AgentEntity agent = agentRepository.findById(agentId);
            if (agent == null) {
                throw new AppException(ResponseCode.NOT_FOUND.getCode(), "Agent not found: " + agentId);
            }
            return endLocked(agent, REASON_SESSION_END);
        }
    }

    /**
     * 结束流程：整段对账、强制完成活动任务、标记结束、广播。调用方必须持有实体锁。
     */
    public SessionEndResult endLocked(AgentEntity agent, String reason) {
        Long agentId = agent.getId();
        if (!agent.isActive()) {
            return new SessionEndResult(agentId, false, null, 0, 0);
        }
        TranscriptReconcileApplicationService.ReconciliationResult reconciled =
                transcriptReconcileApplicationService.reconcileFullSession(agentId);
        LocalDateTime now = LocalDateTime.now();
        TransitionResult completion = agentTaskLifecycleService.forceCompleteActive(agentId, reason, now);
        boolean ended = agentRepository.markEnded(agentId, now);
        if (ended) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("agentId", agentId);
            data.put("reason", reason);
            data.put("endedAt", now.toString());
            monitorEventPublisher.publishAfterCommit(MonitorEventTypeEnum.SESSION_ENDED, agentId, data);
        }
        log.info("SESSION_ENDED agentId={}, reason={}, taskCompleted={}, reconciledUpdated={}, reconciledCreated={}",
                agentId, reason, completion != null, reconciled.updated().size(), reconciled.created().size());
        return new SessionEndResult(agentId, ended, completion, reconciled.updated().size(), reconciled.created().size());
    }

    public record SessionEndResult(Long agentId,
                                   boolean ended,
                                   TransitionResult taskCompletion,
                                   int reconciledUpdated,
                                   int reconciledCreated) {
    }
}
