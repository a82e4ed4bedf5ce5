package com.jz.gateway.guard;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/** 判定解码结果：要么一个 verdict，要么一条解析错误 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VerdictParseResult {

    private final ModerationVerdict verdict;
    private final String error;

    public static VerdictParseResult ok(ModerationVerdict verdict) {
        return new VerdictParseResult(verdict, null);
    }

    public static VerdictParseResult error(String error) {
        return new VerdictParseResult(null, error);
    }

    public boolean isOk() {
        return verdict != null;
    }
}
