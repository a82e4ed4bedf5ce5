package com.jz.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "chat.moderation.llm")
public class LlmModerationProperties {
    private boolean enabled = true;
    private String model = "qwen-plus";
    private long timeoutMs = 30_000;   // 判定调用的截止时间，比普通回复短
}
