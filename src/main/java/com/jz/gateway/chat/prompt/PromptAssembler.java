package com.jz.gateway.chat.prompt;

import com.jz.gateway.chat.stream.GenerationRequest;
import com.jz.gateway.config.GenerationProperties;
import com.jz.gateway.config.LlmModerationProperties;
import com.jz.gateway.domain.dto.InboundMessage;
import com.jz.gateway.domain.entity.AgentProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * 拼生成请求：
 * - 回复：system = agent 角色/描述/要求 + 人设 + “用自然语言回答”；user = 会话来源 + 上下文 + 当前消息；
 * - 审核：system = 分类器指令，只许输出 JSON；user = 群名 + 用户 + 消息。
 */
@Component
@RequiredArgsConstructor
public class PromptAssembler {

    private final GenerationProperties generationProps;
    private final LlmModerationProperties moderationProps;

    static final String NATURAL_LANGUAGE =
            "Please respond in natural language, not JSON format. Provide a conversational response as you would in a normal chat.";

    static final String MODERATION_SYS = """
You are a content moderation assistant for a group chat.
Classify the message below and respond ONLY with this JSON, nothing else:
{"action": "ignore|warn|ban", "reason": "short reason", "user_id": "<the user_id given below>"}
Rules:
1. Analyze the content objectively according to community guidelines (harassment, hate, spam, scams, explicit or illegal content).
2. Use "warn" for a clear but minor violation and "ban" only for severe or malicious content.
3. Do not include any explanations or repeat the original message.
4. If uncertain, use the "ignore" action unless there's clear evidence of a violation.
""";

    public GenerationRequest replyRequest(InboundMessage msg, AgentProfile agent, String context) {
        StringBuilder user = new StringBuilder();
        user.append("[This message is from a ").append(chatKind(msg)).append("]\n");
        if (StringUtils.hasText(context)) {
            user.append(context.stripTrailing()).append("\n\nUser's current message: ").append(msg.getText());
        } else {
            user.append(msg.getText());
        }
        return GenerationRequest.builder()
                .model(modelOf(agent))
                .systemPrompt(replySystem(agent))
                .userPrompt(user.toString())
                .timeout(Duration.ofMillis(generationProps.getTimeoutMs()))
                .purpose("reply")
                .build();
    }

    public GenerationRequest moderationRequest(InboundMessage msg) {
        String handle = StringUtils.hasText(msg.getHandle()) ? msg.getHandle() : "unknown";
        String title = StringUtils.hasText(msg.getChatTitle()) ? msg.getChatTitle() : "Unknown";
        String user = "Group: " + title + "\n"
                + "User: @" + handle + " (user_id: " + msg.getParticipantId() + ")\n"
                + "Message: " + msg.getText();
        return GenerationRequest.builder()
                .model(moderationProps.getModel())
                .systemPrompt(MODERATION_SYS)
                .userPrompt(user)
                .timeout(Duration.ofMillis(moderationProps.getTimeoutMs()))
                .purpose("moderation")
                .build();
    }

    String replySystem(AgentProfile agent) {
        StringBuilder sys = new StringBuilder();
        if (agent != null) {
            if (StringUtils.hasText(agent.getRole())) sys.append("Your role: ").append(agent.getRole()).append('\n');
            if (StringUtils.hasText(agent.getDescription())) sys.append("Description: ").append(agent.getDescription()).append('\n');
            if (StringUtils.hasText(agent.getInstructions())) sys.append("Instructions: ").append(agent.getInstructions()).append('\n');
            if (StringUtils.hasText(agent.getSystemPrompt())) sys.append(agent.getSystemPrompt()).append('\n');
        }
        if (sys.length() > 0) sys.append('\n');
        return sys.append(NATURAL_LANGUAGE).toString();
    }

    private String modelOf(AgentProfile agent) {
        return agent != null && StringUtils.hasText(agent.getModel()) ? agent.getModel() : generationProps.getDefaultModel();
    }

    static String chatKind(InboundMessage msg) {
        if (msg.isPrivateChat()) return "private chat";
        String title = StringUtils.hasText(msg.getChatTitle()) ? msg.getChatTitle() : "unnamed";
        String type = StringUtils.hasText(msg.getChatType()) ? msg.getChatType().toLowerCase() : "group";
        return type + " \"" + title + "\"";
    }
}
