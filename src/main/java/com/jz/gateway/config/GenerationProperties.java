package com.jz.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "chat.generation")
public class GenerationProperties {

    /** 单次生成的截止时间（3 分钟） */
    private long timeoutMs = 180_000;

    /** 每累积 N 个字符推一次中间结果，避免打爆平台的编辑频率限制 */
    private int partialUpdateEveryChars = 20;

    /** agent 未指定模型时使用 */
    private String defaultModel = "qwen-plus";

    /** 可用模型（每个模型一个无记忆 ChatClient） */
    private List<String> models = new ArrayList<>(List.of("qwen-max", "qwen-plus", "qwen-turbo"));

    private double temperature = 0.7;
    private double topP = 0.9;
}
