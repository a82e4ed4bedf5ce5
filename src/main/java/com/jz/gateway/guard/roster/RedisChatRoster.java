package com.jz.gateway.guard.roster;

import com.jz.gateway.common.PermissionCheckException;
import com.jz.gateway.guard.ChatModerationPort;
import com.jz.gateway.guard.PermissionChecker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * 本地群花名册：既回答“是不是管理员/成员”，也承接禁言、封禁、解封。
 * Key 形如：
 * - {prefix}{chatId}:admins   SET
 * - {prefix}{chatId}:members  SET
 * - {prefix}{chatId}:banned   SET
 * - {prefix}{chatId}:muted    HASH participantId -> 禁言截止 epoch millis
 */
@Slf4j
@Component
public class RedisChatRoster implements PermissionChecker, ChatModerationPort {

    private final StringRedisTemplate redis;
    private final Clock clock;
    private final String prefix;

    public RedisChatRoster(StringRedisTemplate redis,
                           Clock clock,
                           @Value("${chat.roster.key-prefix:gw:roster:}") String prefix) {
        this.redis = redis;
        this.clock = clock;
        this.prefix = prefix;
    }

    private String admins(String chatId)  { return prefix + chatId + ":admins"; }
    private String members(String chatId) { return prefix + chatId + ":members"; }
    private String banned(String chatId)  { return prefix + chatId + ":banned"; }
    private String muted(String chatId)   { return prefix + chatId + ":muted"; }

    @Override
    public boolean isAdmin(String participantId, String chatId) {
        try {
            return Boolean.TRUE.equals(redis.opsForSet().isMember(admins(chatId), participantId));
        } catch (RuntimeException e) {
            throw new PermissionCheckException("admin lookup failed for " + participantId + " in " + chatId, e);
        }
    }

    @Override
    public boolean isMember(String participantId, String chatId) {
        try {
            return Boolean.TRUE.equals(redis.opsForSet().isMember(members(chatId), participantId));
        } catch (RuntimeException e) {
            throw new PermissionCheckException("member lookup failed for " + participantId + " in " + chatId, e);
        }
    }

    @Override
    public void restrict(String participantId, String chatId, Instant until) {
        redis.opsForHash().put(muted(chatId), participantId, String.valueOf(until.toEpochMilli()));
    }

    @Override
    public void ban(String participantId, String chatId) {
        redis.opsForSet().remove(members(chatId), participantId);
        redis.opsForSet().add(banned(chatId), participantId);
    }

    @Override
    public void unban(String participantId, String chatId) {
        redis.opsForSet().remove(banned(chatId), participantId);
    }

    /**
     * 管理员解除封禁并把人拉回群里。之后这个人重新算作成员，警告档案在下次警告时按复入群处理。
     */
    public void readmit(String participantId, String chatId) {
        unban(participantId, chatId);
        redis.opsForSet().add(members(chatId), participantId);
        redis.opsForHash().delete(muted(chatId), participantId);
        log.info("[Roster] {} re-admitted to {}", participantId, chatId);
    }

    /**
     * 入群事件。仍在封禁名单里的人不能加入。
     *
     * @return 是否成为成员
     */
    public boolean join(String participantId, String chatId) {
        if (Boolean.TRUE.equals(redis.opsForSet().isMember(banned(chatId), participantId))) {
            log.info("[Roster] {} is banned from {}, join refused", participantId, chatId);
            return false;
        }
        redis.opsForSet().add(members(chatId), participantId);
        return true;
    }

    public void leave(String participantId, String chatId) {
        redis.opsForSet().remove(members(chatId), participantId);
    }

    public void setAdmin(String participantId, String chatId, boolean admin) {
        if (admin) {
            redis.opsForSet().add(admins(chatId), participantId);
        } else {
            redis.opsForSet().remove(admins(chatId), participantId);
        }
    }

    /** 仍在禁言期内则返回截止时间 */
    public Optional<Instant> mutedUntil(String participantId, String chatId) {
        Object v = redis.opsForHash().get(muted(chatId), participantId);
        if (v == null) return Optional.empty();
        Instant until;
        try {
            until = Instant.ofEpochMilli(Long.parseLong(v.toString()));
        } catch (NumberFormatException e) {
            log.warn("[Roster] bad mute entry for {} in {}: {}", participantId, chatId, v);
            return Optional.empty();
        }
        return until.isAfter(clock.instant()) ? Optional.of(until) : Optional.empty();
    }

    public boolean isBanned(String participantId, String chatId) {
        return Boolean.TRUE.equals(redis.opsForSet().isMember(banned(chatId), participantId));
    }
}
