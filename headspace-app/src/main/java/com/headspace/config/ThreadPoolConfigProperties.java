package com.headspace.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 通用线程池配置，前缀 thread.pool.executor.config。
 * <p>
 * 该线程池承载延迟完成捕获，每个任务在等锁期间会占用两条数据库连接。
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "thread.pool.executor.config", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数 */
    private Integer corePoolSize = 4;

    /** 最大线程数 */
    private Integer maxPoolSize = 4;

    /** 空闲线程最大存活时间（秒） */
    private Long keepAliveTime = 60L;

    /** 阻塞队列最大容量 */
    private Integer blockQueueSize = 500;

    /**
     * 拒绝策略：AbortPolicy、DiscardPolicy、DiscardOldestPolicy、CallerRunsPolicy。
     */
    private String policy = "AbortPolicy";

}
