package com.jz.gateway.chat.stream;

import com.jz.gateway.config.GenerationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;

/**
 * 基于 Spring AI ChatClient 的流式 token 源：每个 ChatResponse 分片映射为一个 TokenEvent，
 * 上游正常结束后补一个 END 哨兵。
 */
@Component
@RequiredArgsConstructor
public class ChatClientTokenFeed implements TokenFeed {

    private final Map<String, ChatClient> statelessChatClients;
    private final GenerationProperties props;

    ChatClient client(String model) {
        String name = StringUtils.hasText(model) ? model : props.getDefaultModel();
        return Optional.ofNullable(statelessChatClients.get(name))
                .or(() -> Optional.ofNullable(statelessChatClients.get(props.getDefaultModel())))
                .orElseGet(() -> statelessChatClients.values().iterator().next());
    }

    @Override
    public Flux<TokenEvent> open(GenerationRequest request) {
        ChatClient.ChatClientRequestSpec spec = client(request.getModel()).prompt();
        if (StringUtils.hasText(request.getSystemPrompt())) {
            spec = spec.system(request.getSystemPrompt());
        }
        return spec.user(request.getUserPrompt())
                .stream()
                .chatResponse()
                .map(ChatClientTokenFeed::toEvent)
                .concatWith(Mono.just(TokenEvent.end()));
    }

    static TokenEvent toEvent(ChatResponse response) {
        if (response == null) {
            return TokenEvent.malformed("null chunk");
        }
        Generation g = response.getResult();
        // 只带 usage/finishReason 的尾包：没有文本，但不算坏包
        if (g == null || g.getOutput() == null || g.getOutput().getText() == null) {
            return TokenEvent.token("");
        }
        return TokenEvent.token(g.getOutput().getText());
    }
}
