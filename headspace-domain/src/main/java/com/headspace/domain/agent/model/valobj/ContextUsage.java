package com.headspace.domain.agent.model.valobj;

/**
 * 上下文窗口使用情况。remainingTokens 保留原始写法，如 "45k"。
 */
public record ContextUsage(int percentUsed, String remainingTokens) {
}
