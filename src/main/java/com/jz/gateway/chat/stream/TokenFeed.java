package com.jz.gateway.chat.stream;

import reactor.core.publisher.Flux;

/**
 * “流式出 token”能力。返回的 Flux 以 {@link TokenEvent#end()} 结尾；
 * 传输层错误以 error 信号结束。
 */
public interface TokenFeed {
    Flux<TokenEvent> open(GenerationRequest request);
}
