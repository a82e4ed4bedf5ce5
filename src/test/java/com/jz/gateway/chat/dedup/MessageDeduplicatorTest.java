package com.jz.gateway.chat.dedup;

import com.jz.gateway.config.DedupProperties;
import com.jz.gateway.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class MessageDeduplicatorTest {

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private MessageDeduplicator dedup;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        registry = new SimpleMeterRegistry();
        dedup = new MessageDeduplicator(new DedupProperties(), clock, mock(ScheduledExecutorService.class), registry);
    }

    @Test
    void sameMessageIdSuppressedUntilTtlElapses() {
        assertFalse(dedup.shouldSuppress("u1", "m1", "hello"));
        clock.advanceMillis(1_000);
        assertTrue(dedup.shouldSuppress("u1", "m1", "hello"));
        clock.advanceMillis(9_000);
        assertFalse(dedup.shouldSuppress("u1", "m1", "hello"));
    }

    @Test
    void sameTextUnderNewIdSuppressedOnlyInsideShortWindow() {
        assertFalse(dedup.shouldSuppress("u1", "m1", "what's the weather"));
        clock.advanceMillis(2_000);
        assertTrue(dedup.shouldSuppress("u1", "m2", "what's the weather"));
        clock.advanceMillis(3_000);
        assertFalse(dedup.shouldSuppress("u1", "m3", "what's the weather"));
    }

    @Test
    void sharedPrefixButDifferentTextIsNotADuplicate() {
        assertFalse(dedup.shouldSuppress("u1", "m1", "12345678901234567890 first"));
        assertFalse(dedup.shouldSuppress("u1", "m2", "12345678901234567890 second"));
    }

    @Test
    void participantsAreIndependent() {
        assertFalse(dedup.shouldSuppress("u1", "m1", "hi"));
        assertFalse(dedup.shouldSuppress("u2", "m1", "hi"));
    }

    @Test
    void sweepDropsExpiredEntries() {
        dedup.shouldSuppress("u1", "m1", "a");
        dedup.shouldSuppress("u2", "m2", "b");
        assertEquals(4, dedup.size());

        clock.advanceMillis(10_000);
        dedup.sweep();
        assertEquals(0, dedup.size());
    }

    @Test
    void suppressionsAreCountedByKind() {
        dedup.shouldSuppress("u1", "m1", "x");
        dedup.shouldSuppress("u1", "m1", "x");
        dedup.shouldSuppress("u1", "m2", "x");

        assertEquals(1.0, registry.get("gateway.dedup.suppressed").tag("by", "message_id").counter().count());
        assertEquals(1.0, registry.get("gateway.dedup.suppressed").tag("by", "text").counter().count());
    }
}
