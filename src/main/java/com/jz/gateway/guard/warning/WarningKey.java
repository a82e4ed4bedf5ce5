package com.jz.gateway.guard.warning;

import java.util.Objects;

/** 警告按 (participant, chat) 计，与 agent 无关 */
public record WarningKey(String participantId, String chatId) {

    public WarningKey {
        Objects.requireNonNull(participantId, "participantId");
        Objects.requireNonNull(chatId, "chatId");
    }

    public String id() {
        return "p:" + participantId + ":c:" + chatId;
    }
}
