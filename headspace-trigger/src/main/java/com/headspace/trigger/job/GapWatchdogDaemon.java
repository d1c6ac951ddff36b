package com.headspace.trigger.job;

import com.headspace.trigger.application.monitor.GapWatchdogApplicationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 回合缺口看门狗守护进程。
 */
@Slf4j
@Component
public class GapWatchdogDaemon {

    private final GapWatchdogApplicationService gapWatchdogApplicationService;
    private final boolean enabled;

    public GapWatchdogDaemon(GapWatchdogApplicationService gapWatchdogApplicationService,
                             @Value("${watchdog.enabled:true}") boolean enabled) {
        this.gapWatchdogApplicationService = gapWatchdogApplicationService;
        this.enabled = enabled;
    }

    @Scheduled(fixedDelayString = "${watchdog.poll-interval-ms:3000}", scheduler = "daemonScheduler")
    public void watch() {
        if (!enabled) {
            return;
        }
        GapWatchdogApplicationService.WatchdogTickResult result = gapWatchdogApplicationService.checkOnce();
        if (result.reconciled() > 0) {
            log.info("Gap watchdog triggered reconcile. sampled={}, reconciled={}, openGaps={}",
                    result.sampled(), result.reconciled(), result.openGaps());
        }
    }
}
