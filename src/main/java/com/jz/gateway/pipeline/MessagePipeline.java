package com.jz.gateway.pipeline;

import com.jz.gateway.chat.async.MessageHandle;
import com.jz.gateway.chat.async.OutboundMessenger;
import com.jz.gateway.chat.dedup.MessageDeduplicator;
import com.jz.gateway.chat.prompt.PromptAssembler;
import com.jz.gateway.chat.stream.GenerationOutcome;
import com.jz.gateway.chat.stream.StreamAggregator;
import com.jz.gateway.config.WarningProperties;
import com.jz.gateway.domain.dto.InboundMessage;
import com.jz.gateway.domain.entity.AgentProfile;
import com.jz.gateway.guard.AuthorizationResolver;
import com.jz.gateway.guard.MessageAuthorization;
import com.jz.gateway.guard.ModerationDecisionEngine;
import com.jz.gateway.guard.ModerationVerdict;
import com.jz.gateway.guard.warning.SanctionNotices;
import com.jz.gateway.guard.warning.WarningKey;
import com.jz.gateway.guard.warning.WarningLedger;
import com.jz.gateway.guard.warning.WarningResult;
import com.jz.gateway.memory.ConversationKey;
import com.jz.gateway.memory.ConversationMemoryService;
import com.jz.gateway.memory.MessageRole;
import com.jz.gateway.service.AgentProfileService;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * 单条入站消息的完整处理：去重 → (群聊) 审核 + 警告 → 上下文 → 流式生成 → 记忆。
 * <p>
 * 除了被去重丢弃和群里的旁听消息，每条消息都恰好得到一个可见的终态：回复、处罚通知或致歉。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessagePipeline {

    static final String PLACEHOLDER = "Processing your message...";
    static final String EMPTY_REPLY = "Please try again.";
    static final String TIMEOUT_APOLOGY =
            "⚠️ Sorry, the response is taking too long. Please try again with a simpler query or try later.";
    static final String GENERIC_APOLOGY = "⚠️ Sorry, I'm having trouble processing your request right now.";
    static final String INTERRUPTED = "\n\n⚠️ (response interrupted)";

    private final MessageDeduplicator deduplicator;
    private final AgentProfileService agentService;
    private final AuthorizationResolver authorizationResolver;
    private final ModerationDecisionEngine moderation;
    private final WarningLedger ledger;
    private final WarningProperties warningProps;
    private final ConversationMemoryService memory;
    private final PromptAssembler prompts;
    private final StreamAggregator aggregator;
    private final OutboundMessenger messenger;
    private final Clock clock;
    private final MeterRegistry registry;

    public PipelineOutcome handle(InboundMessage msg) {
        if (deduplicator.shouldSuppress(msg.getParticipantId(), msg.getMessageId(), msg.getText())) {
            return count(PipelineOutcome.SUPPRESSED_DUPLICATE);
        }
        try {
            if (msg.getText() == null || msg.getText().isBlank()) {
                return apologize(msg.getChatId(), GENERIC_APOLOGY);
            }
            AgentProfile agent = resolveAgent(msg.getAgentId());

            if (!msg.isPrivateChat()) {
                MessageAuthorization auth = authorizationResolver.resolve(msg.getParticipantId(), msg.getChatId());
                ModerationVerdict verdict = moderation.classify(msg, agent, auth);
                if (verdict.requiresAction()) {
                    return sanction(msg, agent, verdict, auth);
                }
                if (!msg.expectsReply()) {
                    return count(PipelineOutcome.OBSERVED);
                }
            }
            return reply(msg, agent);
        } catch (RuntimeException e) {
            log.error("[Pipeline] message {} from {} in {} failed", msg.getMessageId(), msg.getParticipantId(), msg.getChatId(), e);
            return apologize(msg.getChatId(), GENERIC_APOLOGY);
        }
    }

    private PipelineOutcome sanction(InboundMessage msg, AgentProfile agent, ModerationVerdict verdict, MessageAuthorization auth) {
        WarningKey key = new WarningKey(msg.getParticipantId(), msg.getChatId());
        String notice;
        if (verdict.getAction() == ModerationVerdict.Action.BAN) {
            WarningResult r = ledger.ban(key, verdict.getReason(), agent.agentKey());
            notice = SanctionNotices.directBan(r, msg.getHandle());
            log.info("[Pipeline] ban verdict for {} in {} -> {}", key.participantId(), key.chatId(), r.getAction().code());
        } else {
            WarningResult r = ledger.addWarning(key, verdict.getReason(), agent.agentKey(), auth);
            notice = SanctionNotices.of(r, msg.getHandle(), warningProps);
            log.info("[Pipeline] warning for {} in {} -> {} ({} warnings)",
                    key.participantId(), key.chatId(), r.getAction().code(), r.getWarningCount());
        }
        messenger.send(msg.getChatId(), notice);
        return count(PipelineOutcome.SANCTIONED);
    }

    private PipelineOutcome reply(InboundMessage msg, AgentProfile agent) {
        long start = clock.millis();
        ConversationKey ckey = new ConversationKey(msg.getParticipantId(), msg.getChatId(), agent.agentKey());

        // 先取上下文再记本条，避免当前消息在提示词里出现两次
        String context = memory.buildContext(ckey);
        memory.recordMessage(ckey, MessageRole.USER, msg.getText());

        MessageHandle handle = messenger.send(msg.getChatId(), PLACEHOLDER);
        GenerationOutcome out = aggregator.generate(
                prompts.replyRequest(msg, agent, context),
                partial -> tryEdit(handle, partial + "..."));

        switch (out.getStatus()) {
            case COMPLETED -> {
                String text = out.getText() == null ? "" : out.getText().trim();
                deliver(handle, text.isEmpty() ? EMPTY_REPLY : text);
                memory.recordMessage(ckey, MessageRole.ASSISTANT, text);
                recordServed(agent, clock.millis() - start);
                return count(PipelineOutcome.REPLIED);
            }
            case TIMEOUT -> {
                log.warn("[Pipeline] generation timed out after {} for {} ({} chars streamed)",
                        out.getTimeout(), ckey.id(), out.getText() == null ? 0 : out.getText().length());
                deliver(handle, TIMEOUT_APOLOGY);
                return count(PipelineOutcome.APOLOGIZED);
            }
            default -> {
                String partial = out.getText() == null ? "" : out.getText().trim();
                log.warn("[Pipeline] stream error for {} after {} chars: {}", ckey.id(), partial.length(),
                        out.getCause() == null ? "unknown" : out.getCause().getMessage());
                deliver(handle, partial.isEmpty() ? GENERIC_APOLOGY : partial + INTERRUPTED);
                return count(PipelineOutcome.APOLOGIZED);
            }
        }
    }

    private AgentProfile resolveAgent(Long agentId) {
        if (agentId != null) {
            AgentProfile a = agentService.getByIdCached(agentId);
            if (a != null) return a;
            log.warn("[Pipeline] agent {} not found, using default", agentId);
        }
        return agentService.getDefaultAgent();
    }

    private void recordServed(AgentProfile agent, long elapsedMs) {
        try {
            agentService.recordServed(agent.getId(), elapsedMs);
        } catch (RuntimeException e) {
            log.warn("[Pipeline] could not update stats for agent {}: {}", agent.getId(), e.getMessage());
        }
    }

    /** 中间结果编辑失败无所谓，下一次编辑或终态会覆盖 */
    private void tryEdit(MessageHandle handle, String text) {
        try {
            messenger.edit(handle, text);
        } catch (RuntimeException e) {
            log.debug("[Pipeline] partial edit failed for message {}: {}", handle.messageId(), e.getMessage());
        }
    }

    /** 终态：优先原地编辑，失败则另发一条 */
    private void deliver(MessageHandle handle, String text) {
        try {
            messenger.edit(handle, text);
        } catch (RuntimeException e) {
            log.warn("[Pipeline] final edit failed for message {}, sending a new message: {}", handle.messageId(), e.getMessage());
            messenger.send(handle.chatId(), text);
        }
    }

    private PipelineOutcome apologize(String chatId, String text) {
        try {
            messenger.send(chatId, text);
        } catch (RuntimeException e) {
            log.error("[Pipeline] could not deliver apology to {}: {}", chatId, e.getMessage());
        }
        return count(PipelineOutcome.APOLOGIZED);
    }

    private PipelineOutcome count(PipelineOutcome outcome) {
        registry.counter("gateway.pipeline.outcome", "outcome", outcome.name().toLowerCase()).increment();
        return outcome;
    }
}
