package com.jz.gateway.chat.stream;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class GenerationRequest {
    /** 模型名；为空时用默认模型 */
    String model;
    String systemPrompt;
    String userPrompt;
    Duration timeout;
    /** 仅用于日志/指标：reply / moderation / summary */
    @Builder.Default
    String purpose = "reply";
}
