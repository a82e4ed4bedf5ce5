package com.jz.gateway.chat.stream;

import com.jz.gateway.common.GenerationTimeoutException;
import com.jz.gateway.common.StreamErrorException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Duration;

/**
 * 一次生成调用的唯一结果：成功 / 超时 / 流错误。
 * 超时时 text 为截止前已累积的部分，调用方自行决定是否展示。
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GenerationOutcome {

    public enum Status { COMPLETED, TIMEOUT, STREAM_ERROR }

    private final Status status;
    private final String text;
    private final Duration timeout;
    private final Throwable cause;

    public static GenerationOutcome completed(String text) {
        return new GenerationOutcome(Status.COMPLETED, text, null, null);
    }

    public static GenerationOutcome timeout(String partialText, Duration timeout) {
        return new GenerationOutcome(Status.TIMEOUT, partialText, timeout, null);
    }

    public static GenerationOutcome streamError(String partialText, Throwable cause) {
        return new GenerationOutcome(Status.STREAM_ERROR, partialText, null, cause);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    /** 成功返回全文；否则抛出对应异常 */
    public String textOrThrow() {
        return switch (status) {
            case COMPLETED -> text;
            case TIMEOUT -> throw new GenerationTimeoutException(timeout);
            case STREAM_ERROR -> throw new StreamErrorException(
                    cause == null ? "stream error" : String.valueOf(cause.getMessage()), text, cause);
        };
    }
}
