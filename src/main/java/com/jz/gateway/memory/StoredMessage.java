package com.jz.gateway.memory;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StoredMessage {
    private MessageRole role;     // user / assistant / system
    private String content;       // 已 trim
    private long ts;              // epoch millis

    public static StoredMessage of(MessageRole role, String content, long ts) {
        return new StoredMessage(role, content, ts);
    }

    public boolean hasContent() {
        return content != null && !content.isBlank();
    }
}
