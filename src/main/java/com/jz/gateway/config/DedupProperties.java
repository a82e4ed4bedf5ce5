package com.jz.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "chat.dedup")
public class DedupProperties {

    /** 同一 (participant, messageId) 的抑制窗口 */
    private long ttlMs = 10_000;

    /** 同一用户相同文本（不同 messageId）的抑制窗口 */
    private long textWindowMs = 3_000;

    /** 文本 key 只取前 N 个字符 */
    private int textPrefixLength = 20;

    private long sweepIntervalMs = 5_000;
}
