package com.jz.gateway.config;


import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Configuration
public class ChatClientConfig {

    /**
     * 每个模型名一个无记忆 ChatClient（不装任何 Advisor）。
     * 对话记忆由 ConversationMemoryService 自己拼进 prompt，避免和 Advisor 重复注入。
     */
    @Bean
    public Map<String, ChatClient> statelessChatClients(ChatModel chatModel, GenerationProperties props) {
        return props.getModels().stream().distinct().collect(Collectors.toMap(
                Function.identity(),
                model -> ChatClient.builder(chatModel)
                        .defaultOptions(ChatOptions.builder()
                                .model(model)
                                .temperature(props.getTemperature())
                                .topP(props.getTopP())
                                .build())
                        .build(),
                (a, b) -> a,
                LinkedHashMap::new
        ));
    }
}
