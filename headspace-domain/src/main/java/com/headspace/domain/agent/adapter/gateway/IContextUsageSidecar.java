package com.headspace.domain.agent.adapter.gateway;

import com.headspace.domain.agent.model.valobj.ContextUsage;

import java.time.Duration;

/**
 * 状态栏旁路文件：面板解析失败时的上下文用量来源。
 */
public interface IContextUsageSidecar {

    /**
     * @return 文件不存在、过期或无法解析时返回 null
     */
    ContextUsage read(String paneId, Duration maxAge);
}
