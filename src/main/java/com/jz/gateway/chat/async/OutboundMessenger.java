package com.jz.gateway.chat.async;

/**
 * 向平台发消息 / 原地编辑消息。失败抛 RuntimeException。
 */
public interface OutboundMessenger {

    MessageHandle send(String chatId, String text);

    void edit(MessageHandle handle, String text);
}
