package com.headspace.domain.lock.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * pg_locks 中的一条 advisory lock 记录。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeldAdvisoryLockVO {

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
