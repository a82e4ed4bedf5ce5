package com.jz.gateway.guard;

import com.jz.gateway.chat.prompt.PromptAssembler;
import com.jz.gateway.chat.stream.GenerationOutcome;
import com.jz.gateway.chat.stream.StreamAggregator;
import com.jz.gateway.config.LlmModerationProperties;
import com.jz.gateway.domain.dto.InboundMessage;
import com.jz.gateway.domain.entity.AgentProfile;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 群消息审核：管理员直接放行；否则调用分类模型并严格解析判定。
 * 任何失败（超时、流错误、解析失败）都放行，审核不会挡住用户。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModerationDecisionEngine {

    static final String PARSE_ERROR = "parse error";

    private final PromptAssembler promptAssembler;
    private final StreamAggregator aggregator;
    private final VerdictParser parser;
    private final LlmModerationProperties props;
    private final MeterRegistry registry;

    public ModerationVerdict classify(InboundMessage msg, AgentProfile agent, MessageAuthorization auth) {
        if (auth != null && auth.isAdmin()) {
            log.debug("[Moderation] {} is admin in {}, skip", msg.getParticipantId(), msg.getChatId());
            return count(ModerationVerdict.none("admin"));
        }
        if (!props.isEnabled() || (agent != null && !agent.moderates())) {
            return count(ModerationVerdict.none("moderation disabled"));
        }
        if (msg.getText() == null || msg.getText().isBlank()) {
            return count(ModerationVerdict.none("empty message"));
        }

        GenerationOutcome out = aggregator.generate(promptAssembler.moderationRequest(msg));
        if (!out.isCompleted()) {
            log.warn("[Moderation] classifier unavailable ({}) for message {} in {}, allowing",
                    out.getStatus(), msg.getMessageId(), msg.getChatId());
            return count(ModerationVerdict.none("classifier unavailable: " + out.getStatus().name().toLowerCase()));
        }

        VerdictParseResult parsed = parser.parse(out.getText());
        if (!parsed.isOk()) {
            log.warn("[Moderation] {} for message {}: raw={}", parsed.getError(), msg.getMessageId(), abbreviate(out.getText()));
            return count(ModerationVerdict.none(PARSE_ERROR + ": " + parsed.getError()));
        }

        ModerationVerdict v = parsed.getVerdict();
        if (v.getSubjectId() != null && !v.getSubjectId().equals(msg.getParticipantId())) {
            log.info("[Moderation] classifier named user {} but author is {}, using author",
                    v.getSubjectId(), msg.getParticipantId());
        }
        v.setSubjectId(msg.getParticipantId());
        log.info("[Moderation] verdict {} for {} in {}: {}", v.getAction(), msg.getParticipantId(), msg.getChatId(), v.getReason());
        return count(v);
    }

    private ModerationVerdict count(ModerationVerdict v) {
        registry.counter("gateway.moderation.verdicts", "action", v.getAction().name().toLowerCase()).increment();
        return v;
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
