package com.jz.gateway.domain.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 一条已经从传输层解出来的入站消息。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessage {
    private String participantId;
    /** 用户名，可为空 */
    private String handle;
    private String chatId;
    private String chatTitle;
    /** private / group / supergroup / channel */
    private String chatType;
    private String messageId;
    private String text;
    /** 为空时用默认 agent */
    private Long agentId;
    /** 群聊里是否 @ 了 agent 或回复了 agent；私聊恒为 true */
    private boolean addressed;

    @JsonIgnore
    public boolean isPrivateChat() {
        return chatType == null || "private".equalsIgnoreCase(chatType);
    }

    @JsonIgnore
    public boolean expectsReply() {
        return isPrivateChat() || addressed;
    }
}
