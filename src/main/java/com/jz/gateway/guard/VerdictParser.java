package com.jz.gateway.guard;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 严格解码分类器输出：{ "action": "ignore|warn|ban", "reason": string, "user_id": string }。
 * 允许模型在 JSON 外多包一层代码块或说明文字；其余形状都算解析失败。
 */
@Component
@RequiredArgsConstructor
public class VerdictParser {

    private final ObjectMapper mapper;

    public VerdictParseResult parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return VerdictParseResult.error("empty classifier output");
        }
        String out = raw.trim();
        int b = out.indexOf('{'), e = out.lastIndexOf('}');
        if (b < 0 || e < b) {
            return VerdictParseResult.error("no JSON object in classifier output");
        }
        out = out.substring(b, e + 1);

        JsonNode root;
        try {
            root = mapper.readTree(out);
        } catch (JsonProcessingException ex) {
            return VerdictParseResult.error("invalid JSON: " + ex.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return VerdictParseResult.error("verdict is not an object");
        }

        JsonNode action = root.get("action");
        if (action == null || !action.isTextual()) {
            return VerdictParseResult.error("missing or non-string action");
        }
        JsonNode reason = root.get("reason");
        if (reason != null && !reason.isNull() && !reason.isTextual()) {
            return VerdictParseResult.error("reason must be a string");
        }
        JsonNode userId = root.get("user_id");
        if (userId != null && !userId.isNull() && !userId.isTextual() && !userId.isIntegralNumber()) {
            return VerdictParseResult.error("user_id must be a string");
        }

        ModerationVerdict.Action mapped = switch (action.asText().trim().toLowerCase(Locale.ROOT)) {
            case "ignore" -> ModerationVerdict.Action.NONE;
            case "warn" -> ModerationVerdict.Action.WARN;
            case "ban" -> ModerationVerdict.Action.BAN;
            default -> null;
        };
        if (mapped == null) {
            return VerdictParseResult.error("unrecognized action '" + action.asText() + "'");
        }

        String reasonText = reason == null || reason.isNull() || reason.asText().isBlank()
                ? "No reason provided" : reason.asText().trim();
        String subject = userId == null || userId.isNull() ? null : userId.asText();
        return VerdictParseResult.ok(ModerationVerdict.builder()
                .action(mapped)
                .reason(reasonText)
                .subjectId(subject)
                .build());
    }
}
