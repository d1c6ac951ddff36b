package com.headspace.trigger.application.common;

import com.headspace.domain.lock.model.valobj.LockHandle;
import com.headspace.domain.lock.service.AdvisoryLockManager;
import com.headspace.types.enums.LockNamespaceEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 后台工作循环：逐个 Agent 非阻塞取锁，做完一段有界工作并释放后才处理下一个。
 * <p>
 * 同一时刻每个工作线程最多持有一个锁会话；锁被占用则跳过，下一轮重试。
 * </p>
 */
@Slf4j
@Component
public class AgentLockSweeper {

    private final AdvisoryLockManager advisoryLockManager;

    public AgentLockSweeper(AdvisoryLockManager advisoryLockManager) {
        this.advisoryLockManager = advisoryLockManager;
    }

    public SweepResult sweep(String workerName, List<Long> agentIds, AgentWork work) {
        if (agentIds == null || agentIds.isEmpty() || work == null) {
            return SweepResult.EMPTY;
        }
        int checked = 0;
        int processed = 0;
        int skippedBusy = 0;
        int failed = 0;
        for (Long agentId : agentIds) {
            if (agentId == null) {
                continue;
            }
            checked++;
            try (LockHandle handle = advisoryLockManager.acquireNonBlocking(LockNamespaceEnum.AGENT, agentId)) {
                if (!handle.isAcquired()) {
                    skippedBusy++;
                    log.debug("Agent lock busy, skipping. worker={}, agentId={}", workerName, agentId);
                    continue;
                }
                work.run(agentId);
                processed++;
            } catch (Exception ex) {
                failed++;
                log.warn("Background work failed. worker={}, agentId={}, error={}", workerName, agentId, ex.getMessage(), ex);
            }
        }
        SweepResult result = new SweepResult(checked, processed, skippedBusy, failed);
        if (failed > 0 || skippedBusy > 0) {
            log.debug("Sweep finished. worker={}, result={}", workerName, result);
        }
        return result;
    }

    public SweepResult sweepOne(String workerName, Long agentId, AgentWork work) {
        return sweep(workerName, agentId == null ? List.of() : List.of(agentId), work);
    }

    @FunctionalInterface
    public interface AgentWork {
        void run(Long agentId) throws Exception;
    }

    public record SweepResult(int checked, int processed, int skippedBusy, int failed) {

        public static final SweepResult EMPTY = new SweepResult(0, 0, 0, 0);
    }
}
