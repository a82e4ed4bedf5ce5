package com.jz.gateway.controller;

import com.jz.gateway.chat.async.OutboundEvent;
import com.jz.gateway.chat.async.PendingReplyBus;
import com.jz.gateway.common.Result;
import com.jz.gateway.domain.dto.InboundMessage;
import com.jz.gateway.domain.dto.RosterUpdateRequest;
import com.jz.gateway.guard.roster.RedisChatRoster;
import com.jz.gateway.guard.warning.WarningInfo;
import com.jz.gateway.guard.warning.WarningKey;
import com.jz.gateway.guard.warning.WarningLedger;
import com.jz.gateway.memory.ConversationKey;
import com.jz.gateway.memory.ConversationMemoryService;
import com.jz.gateway.memory.StoredMessage;
import com.jz.gateway.pipeline.MessagePipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * 本地运行用的薄接口：投递消息、拉取出站消息、查看/清理记忆和警告、维护群花名册。
 */
@Slf4j
@RestController
@RequestMapping("api/gateway")
public class GatewayController {

    private final MessagePipeline pipeline;
    private final PendingReplyBus replyBus;
    private final ConversationMemoryService memory;
    private final WarningLedger ledger;
    private final RedisChatRoster roster;
    private final TaskExecutor chatAsyncExecutor;

    public GatewayController(MessagePipeline pipeline,
                             PendingReplyBus replyBus,
                             ConversationMemoryService memory,
                             WarningLedger ledger,
                             RedisChatRoster roster,
                             @Qualifier("chatAsyncExecutor") TaskExecutor chatAsyncExecutor) {
        this.pipeline = pipeline;
        this.replyBus = replyBus;
        this.memory = memory;
        this.ledger = ledger;
        this.roster = roster;
        this.chatAsyncExecutor = chatAsyncExecutor;
    }

    /** 投递一条入站消息，异步处理；回复通过 /pull 拉取 */
    @PostMapping("/messages")
    public Result<String> submit(@RequestBody InboundMessage msg) {
        if (!StringUtils.hasText(msg.getParticipantId()) || !StringUtils.hasText(msg.getChatId())) {
            return Result.badRequest("participantId and chatId are required");
        }
        if (!StringUtils.hasText(msg.getText())) {
            return Result.badRequest("text must not be empty");
        }
        if (!StringUtils.hasText(msg.getMessageId())) {
            msg.setMessageId(UUID.randomUUID().toString());
        }
        try {
            chatAsyncExecutor.execute(() -> pipeline.handle(msg));
        } catch (TaskRejectedException e) {
            log.warn("[Pipeline] executor saturated, message {} rejected", msg.getMessageId());
            return Result.busy("busy, please retry");
        }
        return Result.success(msg.getMessageId());
    }

    @GetMapping("/pull")
    public Result<List<OutboundEvent>> pull(@RequestParam String chatId,
                                            @RequestParam(defaultValue = "20") int max) {
        return Result.success(replyBus.pull(chatId, max));
    }

    @GetMapping("/memory")
    public Result<List<StoredMessage>> history(@RequestParam String participantId,
                                               @RequestParam String chatId,
                                               @RequestParam String agentId,
                                               @RequestParam(required = false) Integer limit) {
        ConversationKey key = new ConversationKey(participantId, chatId, agentId);
        return Result.success(limit == null ? memory.history(key) : memory.history(key, limit));
    }

    @DeleteMapping("/memory")
    public Result<Boolean> clearMemory(@RequestParam String participantId,
                                       @RequestParam String chatId,
                                       @RequestParam String agentId) {
        boolean cleared = memory.clear(new ConversationKey(participantId, chatId, agentId));
        return cleared
                ? Result.of(200, "🧹 Conversation history has been cleared.", true)
                : Result.of(200, "No conversation history found.", false);
    }

    @GetMapping("/warnings")
    public Result<WarningInfo> warnings(@RequestParam String participantId, @RequestParam String chatId) {
        return ledger.getWarningInfo(new WarningKey(participantId, chatId))
                .map(Result::success)
                .orElseGet(() -> Result.of(200, "no warnings", null));
    }

    @DeleteMapping("/warnings")
    public Result<Boolean> clearWarnings(@RequestParam String participantId,
                                         @RequestParam String chatId,
                                         @RequestParam(defaultValue = "admin") String issuerId) {
        return Result.success(ledger.clearWarnings(new WarningKey(participantId, chatId), issuerId));
    }

    @PostMapping("/roster/join")
    public Result<Boolean> join(@RequestBody RosterUpdateRequest req) {
        return Result.success(roster.join(req.getParticipantId(), req.getChatId()));
    }

    @PostMapping("/roster/leave")
    public Result<Boolean> leave(@RequestBody RosterUpdateRequest req) {
        roster.leave(req.getParticipantId(), req.getChatId());
        return Result.success(true);
    }

    /** 解除封禁，admitted=true 时同时拉回群里 */
    @PostMapping("/roster/unban")
    public Result<Boolean> unban(@RequestBody RosterUpdateRequest req,
                                 @RequestParam(defaultValue = "true") boolean admitted) {
        try {
            if (admitted) {
                roster.readmit(req.getParticipantId(), req.getChatId());
            } else {
                roster.unban(req.getParticipantId(), req.getChatId());
            }
            return Result.success(roster.isMember(req.getParticipantId(), req.getChatId()));
        } catch (RuntimeException e) {
            log.error("[Roster] unban failed for {} in {}: {}", req.getParticipantId(), req.getChatId(), e.getMessage());
            return Result.error("roster unavailable");
        }
    }

    @PostMapping("/roster/admin")
    public Result<Boolean> admin(@RequestBody RosterUpdateRequest req) {
        roster.setAdmin(req.getParticipantId(), req.getChatId(), req.isAdmin());
        return Result.success(req.isAdmin());
    }
}
