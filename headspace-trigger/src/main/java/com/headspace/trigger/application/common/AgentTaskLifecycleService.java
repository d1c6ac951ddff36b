package com.headspace.trigger.application.common;

import com.headspace.domain.task.adapter.repository.IAgentTaskRepository;
import com.headspace.domain.task.model.entity.AgentTaskEntity;
import com.headspace.domain.task.model.valobj.TransitionResult;
import com.headspace.domain.task.service.TaskStateMachine;
import com.headspace.trigger.event.MonitorEventPayloads;
import com.headspace.trigger.event.MonitorEventPublisher;
import com.headspace.types.enums.MonitorEventTypeEnum;
import com.headspace.types.enums.TurnActorEnum;
import com.headspace.types.enums.TurnIntentEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * 任务归属与生命周期完成。调用方必须已持有该 Agent 的实体锁。
 */
@Slf4j
@Component
public class AgentTaskLifecycleService {

    public static final String REASON_SUPERSEDED = "superseded";

    private final IAgentTaskRepository agentTaskRepository;
    private final TaskStateMachine taskStateMachine;
    private final MonitorEventPublisher monitorEventPublisher;

    public AgentTaskLifecycleService(IAgentTaskRepository agentTaskRepository,
                                     TaskStateMachine taskStateMachine,
                                     MonitorEventPublisher monitorEventPublisher) {
        this.agentTaskRepository = agentTaskRepository;
        this.taskStateMachine = taskStateMachine;
        this.monitorEventPublisher = monitorEventPublisher;
    }

    /**
     * 为前台信号确定所属任务：无活动任务或遇到新任务边界时开启新的 IDLE 任务。
     */
    public AgentTaskEntity resolveForSignal(Long agentId,
                                            TurnActorEnum actor,
                                            TurnIntentEnum intent,
                                            String text,
                                            LocalDateTime now) {
        AgentTaskEntity active = agentTaskRepository.findActiveByAgentId(agentId);
        if (active != null && taskStateMachine.startsNewTask(active.getState(), actor, intent)) {
            forceComplete(active, REASON_SUPERSEDED, now);
            active = null;
        }
        if (active != null) {
            return active;
        }
        String instruction = actor == TurnActorEnum.USER && intent == TurnIntentEnum.COMMAND ? text : null;
        AgentTaskEntity opened = agentTaskRepository.save(AgentTaskEntity.open(agentId, instruction, now));
        log.debug("Task opened. agentId={}, taskId={}", agentId, opened.getId());
        return opened;
    }

    /**
     * 为对账新建的回合确定任务：活动任务，否则最近任务，否则新建 IDLE 任务。
     */
    public AgentTaskEntity resolveForReconcile(Long agentId, LocalDateTime now) {
        AgentTaskEntity active = agentTaskRepository.findActiveByAgentId(agentId);
        if (active != null) {
            return active;
        }
        AgentTaskEntity latest = agentTaskRepository.findLatestByAgentId(agentId);
        if (latest != null) {
            return latest;
        }
        return agentTaskRepository.save(AgentTaskEntity.open(agentId, null, now));
    }

    /**
     * 强制完成活动任务；没有活动任务时返回 null。
     */
    public TransitionResult forceCompleteActive(Long agentId, String reason, LocalDateTime now) {
        AgentTaskEntity active = agentTaskRepository.findActiveByAgentId(agentId);
        if (active == null) {
            return null;
        }
        return forceComplete(active, reason, now);
    }

    private TransitionResult forceComplete(AgentTaskEntity task, String reason, LocalDateTime now) {
        TransitionResult result = taskStateMachine.forceComplete(task.getState(), reason);
        boolean updated = agentTaskRepository.updateStateIfMatch(task.getId(), result.fromState(), result.toState(), reason, now);
        if (!updated) {
            log.warn("Task force-complete lost a concurrent update. agentId={}, taskId={}, expectedState={}",
                    task.getAgentId(), task.getId(), result.fromState());
            return null;
        }
        log.info("TASK_COMPLETED agentId={}, taskId={}, fromState={}, reason={}",
                task.getAgentId(), task.getId(), result.fromState(), reason);
        task.setState(result.toState());
        monitorEventPublisher.publishAfterCommit(MonitorEventTypeEnum.STATE_CHANGED, task.getAgentId(),
                MonitorEventPayloads.stateChanged(task, result));
        return result;
    }
}
