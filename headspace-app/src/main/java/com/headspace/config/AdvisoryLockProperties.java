package com.headspace.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 实体锁配置，前缀 advisory-lock。
 */
@Data
@ConfigurationProperties(prefix = "advisory-lock", ignoreInvalidFields = true)
public class AdvisoryLockProperties {

    /** 前台捕获等锁超时（毫秒） */
    private Long foregroundTimeoutMs = 15000L;

    /** 延迟完成等锁超时（毫秒） */
    private Long deferredTimeoutMs = 30000L;

    /** 预计同时持锁的前台请求峰值 */
    private Integer peakForegroundHolders = 8;

    private CapacityCheck capacityCheck = new CapacityCheck();

    @Data
    public static class CapacityCheck {

        /** 连接池容量不足时是否阻止启动 */
        private Boolean failFast = false;
    }
}
