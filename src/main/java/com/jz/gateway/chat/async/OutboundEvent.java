package com.jz.gateway.chat.async;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OutboundEvent {
    public enum Kind { SEND, EDIT }

    private Kind kind;
    private String chatId;
    private long messageId;
    private String text;
    private long ts;
}
