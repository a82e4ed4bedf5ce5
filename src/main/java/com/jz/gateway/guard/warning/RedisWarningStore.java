package com.jz.gateway.guard.warning;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.gateway.common.PersistenceException;
import com.jz.gateway.config.WarningProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 警告档案：Redis STRING + JSON，Key 形如 gw:warn:p:1001:c:-42。不设 TTL，过期按事件时间戳清扫。
 */
@Component
@RequiredArgsConstructor
public class RedisWarningStore implements WarningStore {

    private final StringRedisTemplate redis;
    private final ObjectMapper mapper;
    private final WarningProperties props;

    private String k(WarningKey key) { return props.getKeyPrefix() + key.id(); }

    @Override
    public Optional<WarningRecord> findOne(WarningKey key) {
        String json;
        try {
            json = redis.opsForValue().get(k(key));
        } catch (Exception e) {
            throw new PersistenceException("read warnings " + key.id() + " failed", e);
        }
        if (json == null || json.isEmpty()) return Optional.empty();
        try {
            return Optional.of(mapper.readValue(json, WarningRecord.class));
        } catch (Exception e) {
            throw new PersistenceException("warnings " + key.id() + " are not readable", e);
        }
    }

    @Override
    public void upsert(WarningRecord record) {
        try {
            redis.opsForValue().set(k(record.key()), mapper.writeValueAsString(record));
        } catch (Exception e) {
            throw new PersistenceException("write warnings " + record.key().id() + " failed", e);
        }
    }
}
