package com.jz.gateway.common;

import lombok.Getter;

import java.time.Duration;

/** 生成调用超过截止时间。与 {@link StreamErrorException} 区分处理。 */
@Getter
public class GenerationTimeoutException extends RuntimeException {

    private final Duration timeout;

    public GenerationTimeoutException(Duration timeout) {
        super("generation timed out after " + timeout.toSeconds() + " seconds");
        this.timeout = timeout;
    }
}
