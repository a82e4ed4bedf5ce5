package com.jz.gateway.guard;

import java.time.Instant;

/**
 * 对平台执行处罚。踢出 = ban 后延时 unban，因此没有单独的 remove。
 * 失败直接抛异常，由调用方转换成 *_failed 结果。
 */
public interface ChatModerationPort {

    /** 禁言到 until */
    void restrict(String participantId, String chatId, Instant until);

    void ban(String participantId, String chatId);

    void unban(String participantId, String chatId);
}
