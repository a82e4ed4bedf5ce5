package com.jz.gateway.guard.warning;

import com.jz.gateway.config.WarningProperties;
import org.springframework.util.StringUtils;

import java.time.Duration;

/** 发到群里的处罚通知文案 */
public final class SanctionNotices {

    private SanctionNotices() {}

    public static final String RESET =
            "⚠️ Warning history has been reset for a previously banned user who has been re-added to the group.";

    public static String of(WarningResult r, String handle, WarningProperties props) {
        int banThreshold = props.getBanThreshold();
        String who = StringUtils.hasText(handle) ? "@" + handle : "User";
        String body = switch (r.getAction()) {
            case BANNED -> "🚫 User " + mention(handle) + "has been banned from this group after receiving "
                    + r.getWarningCount() + " warnings.";
            case KICKED -> "⚠️ User " + mention(handle) + "has been removed from this group after receiving "
                    + r.getWarningCount() + " warnings. They can rejoin but will be banned after " + banThreshold + " warnings.";
            case MUTED -> "🔇 User " + mention(handle) + "has been muted for " + describe(props.getMuteDuration()) + " after receiving "
                    + r.getWarningCount() + " warnings.";
            case ALREADY_BANNED -> "🚫 " + who + " is banned from this group.";
            case WARNINGS_RESET -> RESET;
            default -> "⚠️ Warning to " + who + ": " + r.getReason()
                    + " (" + r.getWarningCount() + "/" + banThreshold + ")";
        };
        return r.isReinstated() ? RESET + "\n" + body : body;
    }

    /** 直接封禁（判定为 ban）时的通知 */
    public static String directBan(WarningResult r, String handle) {
        if (r.getAction() != SanctionAction.BANNED) {
            return "⚠️ Warning to " + (StringUtils.hasText(handle) ? "@" + handle : "User") + ": " + r.getReason();
        }
        return "🚫 User " + mention(handle) + "has been banned due to: " + r.getReason();
    }

    static String describe(Duration d) {
        long minutes = d.toMinutes();
        if (minutes > 0 && minutes % 60 == 0) {
            long h = minutes / 60;
            return h == 1 ? "1 hour" : h + " hours";
        }
        return minutes == 1 ? "1 minute" : minutes + " minutes";
    }

    private static String mention(String handle) {
        return StringUtils.hasText(handle) ? "@" + handle + " " : "";
    }
}
