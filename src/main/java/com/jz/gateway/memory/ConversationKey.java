package com.jz.gateway.memory;

import java.util.Objects;

/** 会话 = (participant, chat, agent) 三元组 */
public record ConversationKey(String participantId, String chatId, String agentId) {

    public ConversationKey {
        Objects.requireNonNull(participantId, "participantId");
        Objects.requireNonNull(chatId, "chatId");
        Objects.requireNonNull(agentId, "agentId");
    }

    /** 例如 p:1001:c:-42:a:7 */
    public String id() {
        return "p:" + participantId + ":c:" + chatId + ":a:" + agentId;
    }
}
