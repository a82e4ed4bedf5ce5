package com.jz.gateway.guard.warning;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** 对外展示用的档案摘要，只带最近 3 条警告 */
@Value
@Builder
public class WarningInfo {
    String participantId;
    String chatId;
    int warningCount;
    WarningState state;
    boolean banned;
    Long banDate;
    String banReason;
    Long lastWarningDate;
    List<WarningEvent> recentWarnings;
}
