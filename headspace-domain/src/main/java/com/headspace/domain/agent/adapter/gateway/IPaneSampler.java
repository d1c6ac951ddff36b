package com.headspace.domain.agent.adapter.gateway;

/**
 * 终端面板采样端口（tmux）。
 */
public interface IPaneSampler {

    /**
     * 抓取面板最后若干行。
     *
     * @return 面板不可用时返回 null
     */
    String capturePane(String paneId, int lines);

    boolean isPaneAlive(String paneId);
}
