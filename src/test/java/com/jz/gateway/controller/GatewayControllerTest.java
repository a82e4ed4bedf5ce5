package com.jz.gateway.controller;

import com.jz.gateway.chat.async.PendingReplyBus;
import com.jz.gateway.common.PermissionCheckException;
import com.jz.gateway.common.Result;
import com.jz.gateway.domain.dto.InboundMessage;
import com.jz.gateway.domain.dto.RosterUpdateRequest;
import com.jz.gateway.guard.roster.RedisChatRoster;
import com.jz.gateway.guard.warning.WarningLedger;
import com.jz.gateway.memory.ConversationMemoryService;
import com.jz.gateway.pipeline.MessagePipeline;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class GatewayControllerTest {

    private final MessagePipeline pipeline = mock(MessagePipeline.class);
    private final RedisChatRoster roster = mock(RedisChatRoster.class);
    private final TaskExecutor executor = mock(TaskExecutor.class);
    private final GatewayController controller = new GatewayController(pipeline, mock(PendingReplyBus.class),
            mock(ConversationMemoryService.class), mock(WarningLedger.class), roster, executor);

    private static RosterUpdateRequest member() {
        RosterUpdateRequest req = new RosterUpdateRequest();
        req.setParticipantId("42");
        req.setChatId("-100");
        return req;
    }

    @Test
    void unbanReadmitsByDefault() {
        when(roster.isMember("42", "-100")).thenReturn(true);

        Result<Boolean> r = controller.unban(member(), true);

        assertTrue(r.isOk());
        assertTrue(r.getData());
        verify(roster).readmit("42", "-100");
        verify(roster, never()).unban(any(), any());
    }

    @Test
    void unbanOnlyLiftsTheBan() {
        Result<Boolean> r = controller.unban(member(), false);

        assertFalse(r.getData());
        verify(roster).unban("42", "-100");
        verify(roster, never()).readmit(any(), any());
    }

    @Test
    void rosterOutageIsReportedInTheEnvelope() {
        doThrow(new PermissionCheckException("down", new IllegalStateException())).when(roster).isMember("42", "-100");

        Result<Boolean> r = controller.unban(member(), true);

        assertEquals(500, r.getCode());
        assertNull(r.getData());
    }

    @Test
    void submitValidatesAndReportsSaturation() {
        assertEquals(400, controller.submit(InboundMessage.builder().chatId("c1").text("hi").build()).getCode());
        assertEquals(400, controller.submit(InboundMessage.builder().participantId("42").chatId("c1").text(" ").build()).getCode());

        doThrow(new TaskRejectedException("full")).when(executor).execute(any(Runnable.class));
        Result<String> r = controller.submit(InboundMessage.builder().participantId("42").chatId("c1").text("hi").build());

        assertEquals(503, r.getCode());
        verifyNoInteractions(pipeline);
    }

    @Test
    void acceptedMessageGetsAnIdAndIsHandedToThePipeline() {
        doAnswer(inv -> {
            inv.<Runnable>getArgument(0).run();
            return null;
        }).when(executor).execute(any(Runnable.class));
        InboundMessage msg = InboundMessage.builder().participantId("42").chatId("c1").text("hi").build();

        Result<String> r = controller.submit(msg);

        assertTrue(r.isOk());
        assertNotNull(r.getData());
        assertEquals(r.getData(), msg.getMessageId());
        verify(pipeline).handle(msg);
    }
}
