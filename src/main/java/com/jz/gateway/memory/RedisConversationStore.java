package com.jz.gateway.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.gateway.common.PersistenceException;
import com.jz.gateway.config.MemoryProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 会话文档：Redis STRING + JSON。
 * Key 形如：{keyPrefix}{conversationKey.id()}，例如 gw:conv:p:1001:c:-42:a:7
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisConversationStore implements ConversationStore {

    private final StringRedisTemplate redis;
    private final ObjectMapper mapper;
    private final MemoryProperties props;

    private String k(ConversationKey key) { return props.getKeyPrefix() + key.id(); }

    @Override
    public Optional<ConversationDoc> findOne(ConversationKey key) {
        String json;
        try {
            json = redis.opsForValue().get(k(key));
        } catch (Exception e) {
            throw new PersistenceException("read conversation " + key.id() + " failed", e);
        }
        if (json == null || json.isEmpty()) return Optional.empty();
        try {
            return Optional.of(mapper.readValue(json, ConversationDoc.class));
        } catch (Exception e) {
            throw new PersistenceException("conversation " + key.id() + " is not readable", e);
        }
    }

    @Override
    public void upsert(ConversationDoc doc) {
        try {
            redis.opsForValue().set(k(doc.key()), mapper.writeValueAsString(doc));
        } catch (Exception e) {
            throw new PersistenceException("write conversation " + doc.key().id() + " failed", e);
        }
    }
}
