package com.headspace.api.dto;

import lombok.Data;

/**
 * Agent 会话注册请求 DTO。
 */
@Data
public class AgentRegisterRequestDTO {

    private String sessionUuid;
    private String transcriptPath;
    private String tmuxPaneId;
}
