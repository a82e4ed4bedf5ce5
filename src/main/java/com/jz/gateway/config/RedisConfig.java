package com.jz.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.gateway.domain.entity.AgentProfile;
import org.springframework.boot.autoconfigure.cache.RedisCacheManagerBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;

import java.time.Duration;

@Configuration
public class RedisConfig {

    /** agents 缓存用 JSON 序列化（实体不实现 Serializable），不缓存 null */
    @Bean
    public RedisCacheManagerBuilderCustomizer agentCacheCustomizer(ObjectMapper mapper) {
        Jackson2JsonRedisSerializer<AgentProfile> ser = new Jackson2JsonRedisSerializer<>(mapper, AgentProfile.class);
        return builder -> builder.withCacheConfiguration("agents",
                RedisCacheConfiguration.defaultCacheConfig()
                        .entryTtl(Duration.ofMinutes(10))
                        .disableCachingNullValues()
                        .prefixCacheNameWith("gw:cache:")
                        .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(ser)));
    }
}
