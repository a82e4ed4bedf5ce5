package com.jz.gateway.guard.warning;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 一个人在一个群里的警告档案。warningCount 在每次清扫后等于未过期事件数。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WarningRecord {
    private String participantId;
    private String chatId;

    @Builder.Default
    private List<WarningEvent> events = new ArrayList<>();

    private int warningCount;
    private Long lastWarningDate;

    private boolean banned;
    private Long banDate;
    private String banReason;

    private long createdAt;

    public static WarningRecord create(WarningKey key, long now) {
        return WarningRecord.builder()
                .participantId(key.participantId())
                .chatId(key.chatId())
                .createdAt(now)
                .build();
    }

    @JsonIgnore
    public WarningKey key() {
        return new WarningKey(participantId, chatId);
    }

    /** 清空警告与封禁状态（管理员清除 / 封禁后复入群） */
    public void reset() {
        events = new ArrayList<>();
        warningCount = 0;
        lastWarningDate = null;
        banned = false;
        banDate = null;
        banReason = null;
    }
}
