package com.jz.gateway.guard;

import lombok.*;

@Data @Builder @NoArgsConstructor @AllArgsConstructor
public class ModerationVerdict {
    public enum Action { NONE, WARN, BAN }

    private Action action;
    private String reason;
    /** 被处理的人，即消息作者 */
    private String subjectId;

    public static ModerationVerdict none(String reason) {
        return ModerationVerdict.builder().action(Action.NONE).reason(reason).build();
    }

    public boolean requiresAction() {
        return action == Action.WARN || action == Action.BAN;
    }
}
