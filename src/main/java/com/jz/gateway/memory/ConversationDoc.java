package com.jz.gateway.memory;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 一个会话文档。messages 有上限（超过触发阈值后最旧的被并入 summary），
 * summary 只追加不覆盖；只有显式 clear 才会清空。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationDoc {
    private String participantId;
    private String chatId;
    private String agentId;

    @Builder.Default
    private List<StoredMessage> messages = new ArrayList<>();

    @Builder.Default
    private String summary = "";

    private long lastActive;
    private long createdAt;

    public static ConversationDoc create(ConversationKey key, long now) {
        return ConversationDoc.builder()
                .participantId(key.participantId())
                .chatId(key.chatId())
                .agentId(key.agentId())
                .createdAt(now)
                .lastActive(now)
                .build();
    }

    @JsonIgnore
    public ConversationKey key() {
        return new ConversationKey(participantId, chatId, agentId);
    }

    @JsonIgnore
    public boolean hasSummary() {
        return summary != null && !summary.isBlank();
    }
}
