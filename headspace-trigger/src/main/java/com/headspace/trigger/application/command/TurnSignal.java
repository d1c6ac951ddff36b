package com.headspace.trigger.application.command;

import com.headspace.types.enums.TurnActorEnum;
import com.headspace.types.enums.TurnIntentEnum;

import java.time.LocalDateTime;

/**
 * 前台回合信号：由 hook 推送，receiptTime 为服务端接收时间。
 */
public record TurnSignal(Long agentId,
                         TurnActorEnum actor,
                         TurnIntentEnum intent,
                         String text,
                         LocalDateTime receiptTime) {

    public TurnSignal withText(String newText) {
        return new TurnSignal(agentId, actor, intent, newText, receiptTime);
    }
}
