package com.headspace.trigger.job;

import com.headspace.trigger.application.common.AgentLockSweeper;
import com.headspace.trigger.application.monitor.ContextPollApplicationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 上下文用量轮询守护进程。
 */
@Slf4j
@Component
public class ContextPollerDaemon {

    private final ContextPollApplicationService contextPollApplicationService;
    private final boolean enabled;

    public ContextPollerDaemon(ContextPollApplicationService contextPollApplicationService,
                               @Value("${context-poller.enabled:true}") boolean enabled) {
        this.contextPollApplicationService = contextPollApplicationService;
        this.enabled = enabled;
    }

    @Scheduled(fixedDelayString = "${context-poller.interval-ms:60000}", scheduler = "daemonScheduler")
    public void poll() {
        if (!enabled) {
            return;
        }
        AgentLockSweeper.SweepResult result = contextPollApplicationService.pollOnce();
        if (result.failed() > 0) {
            log.warn("Context poll pass had failures. checked={}, processed={}, failed={}",
                    result.checked(), result.processed(), result.failed());
        }
    }
}
