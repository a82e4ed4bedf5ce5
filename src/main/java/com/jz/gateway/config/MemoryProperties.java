package com.jz.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "chat.memory")
public class MemoryProperties {

    private String keyPrefix = "gw:conv:";

    /** 消息数超过此值触发摘要 */
    private int summarizeTriggerCount = 30;

    /** 摘要后保留的最近原始消息条数 */
    private int summarizeKeepCount = 5;

    /** buildContext 默认 token 预算 */
    private int contextTokenBudget = 2000;

    /** 估算：约 4 个字符 ≈ 1 token */
    private int charsPerToken = 4;

    /** history() 默认返回条数 */
    private int historyLimit = 20;

    private String summarizerModel = "qwen-turbo";
    private long summarizerTimeoutMs = 30_000;
}
