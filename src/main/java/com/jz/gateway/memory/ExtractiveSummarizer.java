package com.jz.gateway.memory;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 不调模型的兜底摘要：各取用户 / 助手最近 3 段内容的前 50 个字符拼起来。
 * 永远不抛异常。
 */
@Component
public class ExtractiveSummarizer implements Summarizer {

    static final int EXCERPTS_PER_ROLE = 3;
    static final int EXCERPT_CHARS = 50;
    static final String EMPTY = "Conversation details not available.";

    @Override
    public String summarize(List<StoredMessage> messages) {
        List<String> user = new ArrayList<>();
        List<String> assistant = new ArrayList<>();
        if (messages != null) {
            for (StoredMessage m : messages) {
                if (m == null || !m.hasContent()) continue;
                if (m.getRole() == MessageRole.USER) user.add(excerpt(m.getContent()));
                else if (m.getRole() == MessageRole.ASSISTANT) assistant.add(excerpt(m.getContent()));
            }
        }

        StringBuilder sb = new StringBuilder();
        if (!user.isEmpty()) {
            sb.append("User discussed: ").append(String.join("; ", last(user))).append(". ");
        }
        if (!assistant.isEmpty()) {
            sb.append("Assistant provided: ").append(String.join("; ", last(assistant))).append('.');
        }
        String out = sb.toString().trim();
        return out.isEmpty() ? EMPTY : out;
    }

    private static List<String> last(List<String> items) {
        return items.subList(Math.max(0, items.size() - EXCERPTS_PER_ROLE), items.size());
    }

    private static String excerpt(String content) {
        String s = content.trim().replaceAll("\\s+", " ");
        return s.length() <= EXCERPT_CHARS ? s : s.substring(0, EXCERPT_CHARS) + "...";
    }
}
