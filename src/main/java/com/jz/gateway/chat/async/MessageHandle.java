package com.jz.gateway.chat.async;

/** 一条已发出的消息，后续编辑用 */
public record MessageHandle(String chatId, long messageId) {}
