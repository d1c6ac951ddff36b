package com.headspace.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 当前 advisory lock 持有/等待情况 DTO。
 */
@Data
public class AdvisoryLockDTO {

    private Integer pid;
    private String applicationName;
    private String backendState;
    private String namespace;
    private Long entityId;
    private String mode;
    private Boolean granted;
    private LocalDateTime queryStart;
    private Double durationSeconds;
}
