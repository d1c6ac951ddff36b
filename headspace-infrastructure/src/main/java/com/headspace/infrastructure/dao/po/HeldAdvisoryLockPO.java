package com.headspace.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * pg_locks advisory 记录 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeldAdvisoryLockPO {

    private Integer pid;
    private String applicationName;
    private String backendState;
    private Integer namespace;
    private Long entityId;
    private String mode;
    private Boolean granted;
    private LocalDateTime queryStart;
    private Double durationSeconds;
}
