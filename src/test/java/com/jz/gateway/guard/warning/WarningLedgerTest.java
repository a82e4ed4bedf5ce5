package com.jz.gateway.guard.warning;

import com.jz.gateway.common.PersistenceException;
import com.jz.gateway.config.WarningProperties;
import com.jz.gateway.guard.ChatModerationPort;
import com.jz.gateway.guard.MessageAuthorization;
import com.jz.gateway.service.ModerationLogService;
import com.jz.gateway.support.InMemoryWarningStore;
import com.jz.gateway.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class WarningLedgerTest {

    private static final WarningKey KEY = new WarningKey("42", "-100");

    private MutableClock clock;
    private InMemoryWarningStore store;
    private ChatModerationPort port;
    private ModerationLogService moderationLog;
    private WarningProperties props;
    private WarningLedger ledger;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        store = new InMemoryWarningStore();
        port = mock(ChatModerationPort.class);
        moderationLog = mock(ModerationLogService.class);
        props = new WarningProperties();
        ledger = ledgerWith(store);
    }

    private WarningLedger ledgerWith(WarningStore s) {
        SanctionExecutor sanctions = new SanctionExecutor(port, props, clock,
                mock(ScheduledExecutorService.class), new SimpleMeterRegistry());
        return new WarningLedger(s, sanctions, props, clock, moderationLog);
    }

    private static MessageAuthorization stillMember(boolean member) {
        return MessageAuthorization.fixed(KEY.participantId(), KEY.chatId(), false, member);
    }

    private WarningResult warn() {
        clock.advance(Duration.ofMinutes(1));
        return ledger.addWarning(KEY, "spam", "7", stillMember(false));
    }

    private void seed(int events, long eventTs, boolean banned) {
        WarningRecord rec = WarningRecord.create(KEY, eventTs);
        for (int i = 0; i < events; i++) {
            rec.getEvents().add(new WarningEvent("old " + i, eventTs, "7"));
        }
        rec.setWarningCount(events);
        rec.setBanned(banned);
        if (banned) {
            rec.setBanDate(eventTs);
            rec.setBanReason("Exceeded maximum warning threshold (5)");
        }
        store.upsert(rec);
    }

    @Test
    void fiveWarningsEscalateThroughEveryState() {
        List<WarningResult> results = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            results.add(warn());
        }

        assertEquals(List.of(WarningState.WARNED, WarningState.WARNED, WarningState.MUTE_PENDING,
                        WarningState.KICK_PENDING, WarningState.BANNED),
                results.stream().map(WarningResult::getState).toList());
        assertEquals(List.of(SanctionAction.WARNING_RECORDED, SanctionAction.WARNING_RECORDED, SanctionAction.MUTED,
                        SanctionAction.KICKED, SanctionAction.BANNED),
                results.stream().map(WarningResult::getAction).toList());

        verify(port, times(1)).restrict(eq("42"), eq("-100"), any(Instant.class));
        verify(port, times(2)).ban("42", "-100");

        WarningRecord rec = store.raw(KEY);
        assertTrue(rec.isBanned());
        assertEquals(5, rec.getWarningCount());
        assertEquals("Exceeded maximum warning threshold (5)", rec.getBanReason());
        assertNotNull(rec.getBanDate());
    }

    @Test
    void muteLastsConfiguredDuration() {
        warn();
        warn();
        warn();

        verify(port).restrict("42", "-100", clock.instant().plus(Duration.ofHours(1)));
    }

    @Test
    void expiredWarningsAreDroppedOnReadAndBanFlagCleared() {
        seed(5, clock.millis(), true);
        clock.advance(Duration.ofDays(31));

        assertEquals(0, ledger.getWarningCount(KEY));

        WarningRecord rec = store.raw(KEY);
        assertEquals(0, rec.getWarningCount());
        assertTrue(rec.getEvents().isEmpty());
        assertFalse(rec.isBanned());
        assertNull(rec.getBanReason());
        // 平台侧封禁不自动解除
        verify(port, never()).unban(anyString(), anyString());
    }

    @Test
    void warningsInsideRetentionAreKept() {
        seed(2, clock.millis(), false);
        clock.advance(Duration.ofDays(29));

        assertEquals(2, ledger.getWarningCount(KEY));
    }

    @Test
    void directBanIsLiftedOnceItsWarningsExpire() {
        warn();
        warn();
        ledger.ban(KEY, "scam", "7");
        assertTrue(store.raw(KEY).isBanned());

        clock.advance(Duration.ofDays(31));
        WarningRecord rec = ledger.getRecord(KEY).orElseThrow();

        assertEquals(0, rec.getWarningCount());
        assertFalse(rec.isBanned());
        assertFalse(store.raw(KEY).isBanned());
        assertEquals(SanctionAction.WARNING_RECORDED,
                ledger.addWarning(KEY, "spam", "7", stillMember(false)).getAction());
    }

    @Test
    void warningExpiresExactlyAtRetention() {
        seed(1, clock.millis(), false);
        clock.advance(Duration.ofDays(30));

        assertEquals(0, ledger.getWarningCount(KEY));
    }

    @Test
    void bannedUserBackInTheChatStartsOver() {
        seed(5, clock.millis(), true);

        WarningResult r = ledger.addWarning(KEY, "spam again", "7", stillMember(true));

        assertTrue(r.isReinstated());
        assertEquals(SanctionAction.WARNING_RECORDED, r.getAction());
        assertEquals(1, r.getWarningCount());
        assertFalse(store.raw(KEY).isBanned());
        assertTrue(SanctionNotices.of(r, "bob", props).startsWith(SanctionNotices.RESET));
    }

    @Test
    void bannedUserNotInTheChatIsLeftAlone() {
        seed(5, clock.millis(), true);

        WarningResult r = ledger.addWarning(KEY, "spam again", "7", stillMember(false));

        assertEquals(SanctionAction.ALREADY_BANNED, r.getAction());
        assertEquals(WarningState.BANNED, r.getState());
        assertEquals(5, store.raw(KEY).getEvents().size());
        verifyNoInteractions(port);
    }

    @Test
    void failedBanIsReportedAndNotRecorded() {
        seed(4, clock.millis(), false);
        doThrow(new IllegalStateException("not enough rights")).when(port).ban("42", "-100");

        WarningResult r = ledger.addWarning(KEY, "spam", "7", stillMember(false));

        assertEquals(SanctionAction.BAN_FAILED, r.getAction());
        assertEquals(5, r.getWarningCount());
        assertFalse(store.raw(KEY).isBanned());
    }

    @Test
    void failedMuteDoesNotThrow() {
        seed(2, clock.millis(), false);
        doThrow(new IllegalStateException("403")).when(port).restrict(anyString(), anyString(), any());

        assertEquals(SanctionAction.MUTE_FAILED, ledger.addWarning(KEY, "spam", "7", stillMember(false)).getAction());
    }

    @Test
    void clearWarningsResetsEverything() {
        seed(5, clock.millis(), true);

        assertTrue(ledger.clearWarnings(KEY, "admin"));

        WarningRecord rec = store.raw(KEY);
        assertEquals(0, rec.getWarningCount());
        assertTrue(rec.getEvents().isEmpty());
        assertFalse(rec.isBanned());
        verify(moderationLog).record(KEY, SanctionAction.WARNINGS_RESET, 0, "cleared by administrator", "admin");
        assertFalse(ledger.clearWarnings(new WarningKey("nobody", "-100"), "admin"));
    }

    @Test
    void warningInfoShowsThreeMostRecent() {
        for (int i = 0; i < 2; i++) warn();
        clock.advance(Duration.ofMinutes(1));
        ledger.addWarning(KEY, "third", "7", stillMember(false));
        clock.advance(Duration.ofMinutes(1));
        ledger.addWarning(KEY, "fourth", "7", stillMember(false));

        WarningInfo info = ledger.getWarningInfo(KEY).orElseThrow();

        assertEquals(4, info.getWarningCount());
        assertEquals(WarningState.KICK_PENDING, info.getState());
        assertEquals(List.of("spam", "third", "fourth"),
                info.getRecentWarnings().stream().map(WarningEvent::getReason).toList());
        assertTrue(ledger.getWarningInfo(new WarningKey("nobody", "-100")).isEmpty());
    }

    @Test
    void directBanMarksRecordWithVerdictReason() {
        WarningResult r = ledger.ban(KEY, "scam link", "7");

        assertEquals(SanctionAction.BANNED, r.getAction());
        verify(port).ban("42", "-100");
        WarningRecord rec = store.raw(KEY);
        assertTrue(rec.isBanned());
        assertEquals("scam link", rec.getBanReason());
        assertEquals(0, rec.getWarningCount());

        assertEquals(SanctionAction.ALREADY_BANNED, ledger.ban(KEY, "again", "7").getAction());
    }

    @Test
    void storeFailureIsReportedNotThrown() {
        WarningStore broken = mock(WarningStore.class);
        when(broken.findOne(any())).thenThrow(new PersistenceException("redis down", new RuntimeException()));

        WarningResult r = ledgerWith(broken).addWarning(KEY, "spam", "7", stillMember(false));

        assertEquals(SanctionAction.THRESHOLD_CHECK_FAILED, r.getAction());
        verifyNoInteractions(port);
        assertEquals(0, ledgerWith(broken).getWarningCount(KEY));
    }
}
