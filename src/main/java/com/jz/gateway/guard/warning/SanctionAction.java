package com.jz.gateway.guard.warning;

import java.util.Locale;

/** 一次警告/处罚调用的结果 */
public enum SanctionAction {
    WARNING_RECORDED,
    MUTED,
    KICKED,
    BANNED,
    MUTE_FAILED,
    KICK_FAILED,
    BAN_FAILED,
    WARNINGS_RESET,
    ALREADY_BANNED,
    THRESHOLD_CHECK_FAILED;

    /** 日志/落库用的小写形式，如 warning_recorded */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean failed() {
        return this == MUTE_FAILED || this == KICK_FAILED || this == BAN_FAILED || this == THRESHOLD_CHECK_FAILED;
    }
}
