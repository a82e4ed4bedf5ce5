package com.jz.gateway.memory;

import java.util.Optional;

/**
 * 会话文档存储。实现方把底层失败包装为 {@link com.jz.gateway.common.PersistenceException}。
 */
public interface ConversationStore {

    Optional<ConversationDoc> findOne(ConversationKey key);

    /** 整文档写回（调用方负责按 key 串行化读-改-写） */
    void upsert(ConversationDoc doc);
}
