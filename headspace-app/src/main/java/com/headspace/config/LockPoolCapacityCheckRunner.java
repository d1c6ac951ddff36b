package com.headspace.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 启动时校验连接池容量：每个持锁临界区占用两条连接（锁会话 + 业务连接）。
 */
@Slf4j
@Component
@EnableConfigurationProperties(AdvisoryLockProperties.class)
public class LockPoolCapacityCheckRunner implements ApplicationRunner {

    private final AdvisoryLockProperties advisoryLockProperties;
    private final ThreadPoolConfigProperties threadPoolConfigProperties;
    private final int maximumPoolSize;
    private final int daemonPoolSize;

    public LockPoolCapacityCheckRunner(AdvisoryLockProperties advisoryLockProperties,
                                       ThreadPoolConfigProperties threadPoolConfigProperties,
                                       @Value("${spring.datasource.hikari.maximum-pool-size:10}") int maximumPoolSize,
                                       @Value("${scheduling.daemon.pool-size:4}") int daemonPoolSize) {
        this.advisoryLockProperties = advisoryLockProperties;
        this.threadPoolConfigProperties = threadPoolConfigProperties;
        this.maximumPoolSize = maximumPoolSize;
        this.daemonPoolSize = Math.max(daemonPoolSize, 1);
    }

    @Override
    public void run(ApplicationArguments args) {
        int required = requiredConnections();
        if (maximumPoolSize >= required) {
            log.info("Lock pool capacity check passed. maximumPoolSize={}, required={}", maximumPoolSize, required);
            return;
        }
        String message = "Connection pool too small for advisory locking. maximumPoolSize=" + maximumPoolSize
                + ", required=" + required;
        if (Boolean.TRUE.equals(advisoryLockProperties.getCapacityCheck().getFailFast())) {
            throw new IllegalStateException(message);
        }
        log.error("{}. Raise spring.datasource.hikari.maximum-pool-size or lower concurrent lock holders.", message);
    }

    public int requiredConnections() {
        int foreground = Math.max(nullToZero(advisoryLockProperties.getPeakForegroundHolders()), 1);
        int deferredWorkers = Math.max(nullToZero(threadPoolConfigProperties.getMaxPoolSize()), 1);
        return 2 * (foreground + daemonPoolSize + deferredWorkers);
    }

    private int nullToZero(Integer value) {
        return value == null ? 0 : value;
    }
}
