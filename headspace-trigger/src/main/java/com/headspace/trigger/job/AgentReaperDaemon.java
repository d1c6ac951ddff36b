package com.headspace.trigger.job;

import com.headspace.trigger.application.monitor.AgentReapApplicationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 不活跃会话回收守护进程。
 */
@Slf4j
@Component
public class AgentReaperDaemon {

    private final AgentReapApplicationService agentReapApplicationService;
    private final boolean enabled;

    public AgentReaperDaemon(AgentReapApplicationService agentReapApplicationService,
                             @Value("${reaper.enabled:true}") boolean enabled) {
        this.agentReapApplicationService = agentReapApplicationService;
        this.enabled = enabled;
    }

    @Scheduled(fixedDelayString = "${reaper.interval-ms:60000}", scheduler = "daemonScheduler")
    public void reap() {
        if (!enabled) {
            return;
        }
        AgentReapApplicationService.ReapResult result = agentReapApplicationService.reapOnce();
        if (result.failed() > 0) {
            log.warn("Agent reaper pass had failures. checked={}, reaped={}, failed={}",
                    result.checked(), result.reaped(), result.failed());
        }
    }
}
