package com.jz.gateway.guard.warning;

import com.jz.gateway.config.WarningProperties;

public enum WarningState {
    CLEAN,
    WARNED,
    MUTE_PENDING,
    KICK_PENDING,
    BANNED;

    public static WarningState of(int count, boolean banned, WarningProperties props) {
        if (banned || count >= props.getBanThreshold()) return BANNED;
        if (count >= props.getKickThreshold()) return KICK_PENDING;
        if (count >= props.getTempMuteThreshold()) return MUTE_PENDING;
        if (count >= 1) return WARNED;
        return CLEAN;
    }

    public static WarningState of(WarningRecord rec, WarningProperties props) {
        return of(rec.getWarningCount(), rec.isBanned(), props);
    }
}
