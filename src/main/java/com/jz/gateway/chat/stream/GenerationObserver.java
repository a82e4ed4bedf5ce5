package com.jz.gateway.chat.stream;

/** 生成进度回调。onPartial 按字符步长节流触发，不是每个 token 都触发。 */
@FunctionalInterface
public interface GenerationObserver {

    void onPartial(String textSoFar);

    default void onFinal(String finalText) {
    }

    GenerationObserver NONE = text -> { };
}
