package com.jz.gateway.chat.prompt;

import com.jz.gateway.chat.stream.GenerationRequest;
import com.jz.gateway.config.GenerationProperties;
import com.jz.gateway.config.LlmModerationProperties;
import com.jz.gateway.domain.dto.InboundMessage;
import com.jz.gateway.domain.entity.AgentProfile;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class PromptAssemblerTest {

    private final PromptAssembler assembler = new PromptAssembler(new GenerationProperties(), new LlmModerationProperties());

    private static InboundMessage.InboundMessageBuilder msg() {
        return InboundMessage.builder().participantId("42").handle("bob").chatId("-100").text("what time is it?");
    }

    @Test
    void privateReplyWithoutContextIsJustTheMessage() {
        GenerationRequest req = assembler.replyRequest(msg().chatType("private").build(), null, "");

        assertEquals("[This message is from a private chat]\nwhat time is it?", req.getUserPrompt());
        assertEquals("qwen-plus", req.getModel());
        assertEquals(PromptAssembler.NATURAL_LANGUAGE, req.getSystemPrompt());
        assertEquals(Duration.ofMinutes(3), req.getTimeout());
        assertEquals("reply", req.getPurpose());
    }

    @Test
    void groupReplyCarriesContextAndAgentPersona() {
        AgentProfile agent = new AgentProfile();
        agent.setRole("Support assistant");
        agent.setInstructions("Be brief.");
        agent.setModel("qwen-max");
        InboundMessage m = msg().chatType("supergroup").chatTitle("Ops").addressed(true).build();

        GenerationRequest req = assembler.replyRequest(m, agent, "User: hi\n\nAssistant: hello\n\n");

        assertEquals("[This message is from a supergroup \"Ops\"]\nUser: hi\n\nAssistant: hello\n\nUser's current message: what time is it?",
                req.getUserPrompt());
        assertEquals("Your role: Support assistant\nInstructions: Be brief.\n\n" + PromptAssembler.NATURAL_LANGUAGE,
                req.getSystemPrompt());
        assertEquals("qwen-max", req.getModel());
    }

    @Test
    void moderationRequestNamesGroupAndUser() {
        GenerationRequest req = assembler.moderationRequest(msg().chatType("group").chatTitle("Ops").build());

        assertEquals("Group: Ops\nUser: @bob (user_id: 42)\nMessage: what time is it?", req.getUserPrompt());
        assertEquals(PromptAssembler.MODERATION_SYS, req.getSystemPrompt());
        assertEquals(Duration.ofSeconds(30), req.getTimeout());
        assertEquals("moderation", req.getPurpose());
    }
}
