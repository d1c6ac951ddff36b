package com.headspace.infrastructure.dao.po;

import com.headspace.types.enums.TimestampSourceEnum;
import com.headspace.types.enums.TurnActorEnum;
import com.headspace.types.enums.TurnIntentEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 回合 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnPO {

    private Long id;
    private Long agentId;
    private Long taskId;
    private TurnActorEnum actor;
    private TurnIntentEnum intent;
    private String text;
    private LocalDateTime eventTime;
    private TimestampSourceEnum timestampSource;
    private String entryFingerprint;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
