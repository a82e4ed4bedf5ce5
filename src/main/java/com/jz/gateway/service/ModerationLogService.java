package com.jz.gateway.service;

import com.jz.gateway.guard.warning.SanctionAction;
import com.jz.gateway.guard.warning.WarningKey;

public interface ModerationLogService {
    /** 异步落一条处罚留痕；失败只记日志 */
    void record(WarningKey key, SanctionAction action, int warningCount, String reason, String issuerId);
}
