package com.jz.gateway.guard.warning;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WarningResult {
    SanctionAction action;
    WarningState state;
    int warningCount;
    /** 本次警告理由（或封禁理由） */
    String reason;
    /** 本次调用前是否因复入群清空过档案 */
    boolean reinstated;
}
