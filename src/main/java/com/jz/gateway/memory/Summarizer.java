package com.jz.gateway.memory;

import java.util.List;

/** 把一批旧消息压缩成一小段概述。失败时抛 {@link SummarizationException}。 */
public interface Summarizer {
    String summarize(List<StoredMessage> messages);
}
