package com.jz.gateway.guard.warning;

import com.jz.gateway.common.PersistenceException;
import com.jz.gateway.common.StripedLocks;
import com.jz.gateway.config.WarningProperties;
import com.jz.gateway.guard.MessageAuthorization;
import com.jz.gateway.service.ModerationLogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 警告升级状态机：警告 → 禁言 → 踢出 → 封禁。
 * <p>
 * 档案的读-改-写按 key 串行；对平台的处罚调用在锁外执行，
 * 成功封禁后再回写 banned 标记。任何读写都会先清扫过期警告。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WarningLedger {

    private final WarningStore store;
    private final SanctionExecutor sanctions;
    private final WarningProperties props;
    private final Clock clock;
    private final ModerationLogService moderationLog;

    private final StripedLocks locks = new StripedLocks(64);

    /**
     * 记一次警告并按新计数执行对应处罚。
     * 档案已是封禁状态时：本人仍在群里视为复入群，先清空档案再记；否则返回 already_banned。
     */
    public WarningResult addWarning(WarningKey key, String reason, String issuerId, MessageAuthorization auth) {
        Added added;
        try {
            added = locks.withLock(key.id(), () -> {
                long now = clock.millis();
                WarningRecord rec = store.findOne(key).orElseGet(() -> WarningRecord.create(key, now));
                boolean swept = sweep(rec, now);
                boolean reinstated = false;
                if (rec.isBanned()) {
                    if (auth == null || !auth.isMember()) {
                        if (swept) store.upsert(rec);
                        return new Added(rec.getWarningCount(), false, true);
                    }
                    log.info("[Warning] {} rejoined {} after a ban, resetting warning history", key.participantId(), key.chatId());
                    rec.reset();
                    reinstated = true;
                }
                rec.getEvents().add(new WarningEvent(reason, now, issuerId));
                rec.setWarningCount(rec.getEvents().size());
                rec.setLastWarningDate(now);
                store.upsert(rec);
                return new Added(rec.getWarningCount(), reinstated, false);
            });
        } catch (PersistenceException e) {
            log.error("[Warning] could not record warning for {}: {}", key.id(), e.getMessage());
            return result(SanctionAction.THRESHOLD_CHECK_FAILED, 0, false, reason, false);
        }

        if (added.alreadyBanned()) {
            log.info("[Warning] {} is already banned in {}, warning not recorded", key.participantId(), key.chatId());
            return result(SanctionAction.ALREADY_BANNED, added.count(), true, reason, false);
        }
        if (added.reinstated()) {
            moderationLog.record(key, SanctionAction.WARNINGS_RESET, 0, "rejoined after ban", issuerId);
        }
        log.info("[Warning] {} in {} now has {} warning(s): {}", key.participantId(), key.chatId(), added.count(), reason);
        return applyThreshold(key, added.count(), reason, issuerId, added.reinstated());
    }

    /** 判定为 ban 时直接封禁，不记警告 */
    public WarningResult ban(WarningKey key, String reason, String issuerId) {
        int count;
        try {
            Integer current = locks.withLock(key.id(), () -> {
                long now = clock.millis();
                Optional<WarningRecord> found = store.findOne(key);
                if (found.isEmpty()) return 0;
                WarningRecord rec = found.get();
                if (sweep(rec, now)) store.upsert(rec);
                return rec.isBanned() ? null : rec.getWarningCount();
            });
            if (current == null) {
                return result(SanctionAction.ALREADY_BANNED, 0, true, reason, false);
            }
            count = current;
        } catch (PersistenceException e) {
            log.error("[Warning] could not read warnings for {}: {}", key.id(), e.getMessage());
            count = 0;
        }
        if (!sanctions.ban(key)) {
            moderationLog.record(key, SanctionAction.BAN_FAILED, count, reason, issuerId);
            return result(SanctionAction.BAN_FAILED, count, false, reason, false);
        }
        markBanned(key, reason);
        moderationLog.record(key, SanctionAction.BANNED, count, reason, issuerId);
        return result(SanctionAction.BANNED, count, true, reason, false);
    }

    public int getWarningCount(WarningKey key) {
        return getRecord(key).map(WarningRecord::getWarningCount).orElse(0);
    }

    public Optional<WarningInfo> getWarningInfo(WarningKey key) {
        return getRecord(key).map(rec -> {
            List<WarningEvent> events = rec.getEvents();
            return WarningInfo.builder()
                    .participantId(rec.getParticipantId())
                    .chatId(rec.getChatId())
                    .warningCount(rec.getWarningCount())
                    .state(WarningState.of(rec, props))
                    .banned(rec.isBanned())
                    .banDate(rec.getBanDate())
                    .banReason(rec.getBanReason())
                    .lastWarningDate(rec.getLastWarningDate())
                    .recentWarnings(List.copyOf(events.subList(Math.max(0, events.size() - 3), events.size())))
                    .build();
        });
    }

    /** 读档案（先清扫过期并回写） */
    public Optional<WarningRecord> getRecord(WarningKey key) {
        try {
            return locks.withLock(key.id(), () -> {
                Optional<WarningRecord> found = store.findOne(key);
                found.ifPresent(rec -> {
                    if (sweep(rec, clock.millis())) store.upsert(rec);
                });
                return found;
            });
        } catch (PersistenceException e) {
            log.warn("[Warning] warnings unavailable for {}: {}", key.id(), e.getMessage());
            return Optional.empty();
        }
    }

    /** 管理员清除：计数归零，清空事件和封禁状态 */
    public boolean clearWarnings(WarningKey key, String issuerId) {
        boolean cleared;
        try {
            cleared = locks.withLock(key.id(), () -> {
                Optional<WarningRecord> found = store.findOne(key);
                if (found.isEmpty()) return false;
                WarningRecord rec = found.get();
                rec.reset();
                store.upsert(rec);
                return true;
            });
        } catch (PersistenceException e) {
            log.error("[Warning] could not clear warnings for {}: {}", key.id(), e.getMessage());
            return false;
        }
        if (cleared) {
            log.info("[Warning] warnings cleared for {} in {}", key.participantId(), key.chatId());
            moderationLog.record(key, SanctionAction.WARNINGS_RESET, 0, "cleared by administrator", issuerId);
        }
        return cleared;
    }

    private WarningResult applyThreshold(WarningKey key, int count, String reason, String issuerId, boolean reinstated) {
        SanctionAction action;
        boolean bannedNow = false;
        try {
            if (count >= props.getBanThreshold()) {
                if (sanctions.ban(key)) {
                    markBanned(key, "Exceeded maximum warning threshold (" + props.getBanThreshold() + ")");
                    action = SanctionAction.BANNED;
                    bannedNow = true;
                } else {
                    action = SanctionAction.BAN_FAILED;
                }
            } else if (count >= props.getKickThreshold()) {
                action = sanctions.kick(key) ? SanctionAction.KICKED : SanctionAction.KICK_FAILED;
            } else if (count >= props.getTempMuteThreshold()) {
                action = sanctions.mute(key) ? SanctionAction.MUTED : SanctionAction.MUTE_FAILED;
            } else {
                action = SanctionAction.WARNING_RECORDED;
            }
        } catch (RuntimeException e) {
            log.error("[Warning] threshold check failed for {}", key.id(), e);
            action = SanctionAction.THRESHOLD_CHECK_FAILED;
        }
        moderationLog.record(key, action, count, reason, issuerId);
        return result(action, count, bannedNow, reason, reinstated);
    }

    private void markBanned(WarningKey key, String banReason) {
        try {
            locks.withLock(key.id(), () -> {
                long now = clock.millis();
                WarningRecord rec = store.findOne(key).orElseGet(() -> WarningRecord.create(key, now));
                rec.setBanned(true);
                rec.setBanDate(now);
                rec.setBanReason(banReason);
                store.upsert(rec);
            });
        } catch (PersistenceException e) {
            // 平台侧已封禁，本地状态没写上：下次复入群检查会按未封禁处理
            log.error("[Warning] ban applied but not recorded for {}: {}", key.id(), e.getMessage());
        }
    }

    /**
     * 丢弃超过保留期的警告并重算计数。
     * 有警告过期且剩余计数低于封禁阈值时清除 banned；平台侧封禁不会自动解除。
     *
     * @return 档案是否有变化
     */
    boolean sweep(WarningRecord rec, long now) {
        long retentionMs = props.retention().toMillis();
        List<WarningEvent> events = rec.getEvents() == null ? new ArrayList<>() : new ArrayList<>(rec.getEvents());
        int before = events.size();
        int countBefore = rec.getWarningCount();
        events.removeIf(e -> now - e.getTs() >= retentionMs);
        int removed = before - events.size();
        rec.setEvents(events);
        rec.setWarningCount(events.size());
        boolean changed = removed > 0 || countBefore != events.size();

        if (removed > 0) {
            log.info("[Warning] removed {} expired warning(s) for {} in {}", removed, rec.getParticipantId(), rec.getChatId());
            if (rec.isBanned() && events.size() < props.getBanThreshold()) {
                log.info("[Warning] {} in {} dropped below ban threshold, clearing ban flag (platform ban left in place)",
                        rec.getParticipantId(), rec.getChatId());
                rec.setBanned(false);
                rec.setBanDate(null);
                rec.setBanReason(null);
            }
        }
        return changed;
    }

    private WarningResult result(SanctionAction action, int count, boolean banned, String reason, boolean reinstated) {
        return WarningResult.builder()
                .action(action)
                .state(WarningState.of(count, banned, props))
                .warningCount(count)
                .reason(reason)
                .reinstated(reinstated)
                .build();
    }

    private record Added(int count, boolean reinstated, boolean alreadyBanned) {}
}
