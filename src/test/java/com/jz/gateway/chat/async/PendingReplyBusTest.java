package com.jz.gateway.chat.async;

import com.jz.gateway.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PendingReplyBusTest {

    private final PendingReplyBus bus = new PendingReplyBus(MutableClock.atEpoch());

    @Test
    void sendThenEditAreQueuedInOrder() {
        MessageHandle h = bus.send("c1", "Processing your message...");
        bus.edit(h, "Hello...");
        bus.edit(h, "Hello there");

        List<OutboundEvent> events = bus.pull("c1", 10);

        assertEquals(3, events.size());
        assertEquals(OutboundEvent.Kind.SEND, events.get(0).getKind());
        assertEquals(OutboundEvent.Kind.EDIT, events.get(2).getKind());
        assertEquals("Hello there", events.get(2).getText());
        assertTrue(events.stream().allMatch(e -> e.getMessageId() == h.messageId()));
        assertTrue(bus.pull("c1", 10).isEmpty());
    }

    @Test
    void pullRespectsMaxAndChat() {
        bus.send("c1", "a");
        bus.send("c1", "b");
        bus.send("c2", "x");

        assertEquals(List.of("a"), bus.pull("c1", 1).stream().map(OutboundEvent::getText).toList());
        assertEquals(List.of("b"), bus.pull("c1", 5).stream().map(OutboundEvent::getText).toList());
        assertEquals(List.of("x"), bus.pull("c2", 5).stream().map(OutboundEvent::getText).toList());
        assertTrue(bus.pull("unknown", 5).isEmpty());
    }

    @Test
    void editOfUnknownMessageIsRejected() {
        MessageHandle h = bus.send("c1", "a");

        assertThrows(IllegalArgumentException.class, () -> bus.edit(new MessageHandle("c1", 999L), "x"));
        assertThrows(IllegalArgumentException.class, () -> bus.edit(new MessageHandle("c2", h.messageId()), "x"));
    }

    @Test
    void backlogIsCappedByDroppingOldest() {
        for (int i = 1; i <= PendingReplyBus.MAX_QUEUED + 5; i++) {
            bus.send("c1", "m" + i);
        }

        List<OutboundEvent> events = bus.pull("c1", PendingReplyBus.MAX_QUEUED + 100);

        assertEquals(PendingReplyBus.MAX_QUEUED, events.size());
        assertEquals("m6", events.get(0).getText());
        assertEquals("m" + (PendingReplyBus.MAX_QUEUED + 5), events.get(events.size() - 1).getText());
    }

    @Test
    void drainedChatIsForgotten() {
        bus.send("c1", "a");
        bus.send("c1", "b");

        bus.pull("c1", 1);
        assertEquals(1, bus.pendingChats());

        bus.pull("c1", 1);
        assertEquals(0, bus.pendingChats());

        bus.send("c1", "c");
        assertEquals(List.of("c"), bus.pull("c1", 5).stream().map(OutboundEvent::getText).toList());
    }
}
