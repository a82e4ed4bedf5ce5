package com.jz.gateway.guard.warning;

import com.jz.gateway.config.WarningProperties;
import com.jz.gateway.guard.ChatModerationPort;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 对平台执行禁言 / 踢出 / 封禁。每个动作只尝试一次，返回是否成功，不向上抛异常。
 */
@Slf4j
@Component
public class SanctionExecutor {

    private final ChatModerationPort port;
    private final WarningProperties props;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final MeterRegistry registry;

    public SanctionExecutor(ChatModerationPort port,
                            WarningProperties props,
                            Clock clock,
                            @Qualifier("gatewayScheduler") ScheduledExecutorService scheduler,
                            MeterRegistry registry) {
        this.port = port;
        this.props = props;
        this.clock = clock;
        this.scheduler = scheduler;
        this.registry = registry;
    }

    public boolean mute(WarningKey key) {
        Instant until = clock.instant().plus(props.getMuteDuration());
        try {
            port.restrict(key.participantId(), key.chatId(), until);
            log.info("[Warning] muted {} in {} until {}", key.participantId(), key.chatId(), until);
            return count("mute", true);
        } catch (RuntimeException e) {
            log.error("[Warning] mute failed for {} in {}: {}", key.participantId(), key.chatId(), e.getMessage());
            return count("mute", false);
        }
    }

    /** 踢出：先封禁，延时后解封，用户可以重新加入 */
    public boolean kick(WarningKey key) {
        try {
            port.ban(key.participantId(), key.chatId());
        } catch (RuntimeException e) {
            log.error("[Warning] kick failed for {} in {}: {}", key.participantId(), key.chatId(), e.getMessage());
            return count("kick", false);
        }
        try {
            scheduler.schedule(() -> unban(key), props.getKickUnbanDelayMs(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // 调度器已关闭：立即解封，避免踢出变成永久封禁
            log.warn("[Warning] unban could not be scheduled for {} in {}, unbanning now", key.participantId(), key.chatId());
            unban(key);
        }
        log.info("[Warning] kicked {} from {}", key.participantId(), key.chatId());
        return count("kick", true);
    }

    public boolean ban(WarningKey key) {
        try {
            port.ban(key.participantId(), key.chatId());
            log.info("[Warning] banned {} from {}", key.participantId(), key.chatId());
            return count("ban", true);
        } catch (RuntimeException e) {
            log.error("[Warning] ban failed for {} in {}: {}", key.participantId(), key.chatId(), e.getMessage());
            return count("ban", false);
        }
    }

    void unban(WarningKey key) {
        try {
            port.unban(key.participantId(), key.chatId());
            log.debug("[Warning] unbanned {} in {} after kick", key.participantId(), key.chatId());
        } catch (RuntimeException e) {
            log.error("[Warning] unban after kick failed for {} in {}: {}", key.participantId(), key.chatId(), e.getMessage());
        }
    }

    private boolean count(String action, boolean ok) {
        registry.counter("gateway.sanctions", "action", action, "outcome", ok ? "success" : "failure").increment();
        return ok;
    }
}
