package com.jz.gateway.common;

import lombok.Getter;

/**
 * 生成过程中底层流报错。已累积的文本保留在 {@link #getPartialText()}，不重试。
 */
@Getter
public class StreamErrorException extends RuntimeException {

    private final String partialText;

    public StreamErrorException(String message, String partialText, Throwable cause) {
        super(message, cause);
        this.partialText = partialText == null ? "" : partialText;
    }
}
