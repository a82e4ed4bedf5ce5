package com.jz.gateway.memory;

import com.jz.gateway.chat.stream.GenerationOutcome;
import com.jz.gateway.chat.stream.GenerationRequest;
import com.jz.gateway.chat.stream.StreamAggregator;
import com.jz.gateway.config.MemoryProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * 用模型压缩旧消息。超时 / 流错误 / 空输出一律抛 {@link SummarizationException}，
 * 由调用方回退到 {@link ExtractiveSummarizer}。
 */
@Slf4j
@Primary
@Component
@RequiredArgsConstructor
public class LlmSummarizer implements Summarizer {

    private static final String SYS = """
You compress chat history for a conversational assistant.
Summarize the conversation below in at most 5 short sentences.
Keep names, facts, decisions, open questions and user preferences. Drop greetings and filler.
Write in the language the user used. Output the summary text only.
""";

    private final StreamAggregator aggregator;
    private final MemoryProperties props;

    @Override
    public String summarize(List<StoredMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            throw new SummarizationException("nothing to summarize");
        }
        StringBuilder transcript = new StringBuilder();
        for (StoredMessage m : messages) {
            if (!m.hasContent()) continue;
            transcript.append(m.getRole().label()).append(": ").append(m.getContent()).append('\n');
        }

        GenerationRequest req = GenerationRequest.builder()
                .model(props.getSummarizerModel())
                .systemPrompt(SYS)
                .userPrompt(transcript.toString())
                .timeout(Duration.ofMillis(props.getSummarizerTimeoutMs()))
                .purpose("summary")
                .build();

        GenerationOutcome out = aggregator.generate(req);
        if (!out.isCompleted()) {
            throw new SummarizationException("summarizer " + out.getStatus().name().toLowerCase(), out.getCause());
        }
        String text = out.getText() == null ? "" : out.getText().trim();
        if (text.isEmpty()) {
            throw new SummarizationException("summarizer returned empty text");
        }
        log.debug("[Memory] summarized {} messages into {} chars", messages.size(), text.length());
        return text;
    }
}
