package com.jz.gateway.chat.dedup;

import com.jz.gateway.config.DedupProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 入站消息去重（进程内）：
 * - 同一 (participantId, messageId) 在 TTL 内第二次出现 → 抑制；
 * - 同一用户相同文本在短窗口（默认 3s）内再次出现，即使 messageId 不同 → 抑制（不可靠传输的重复投递）。
 * 过期条目由定时清扫 + 读时惰性判断共同处理，清扫不阻塞调用方。
 */
@Slf4j
@Component
public class MessageDeduplicator {

    private final DedupProperties props;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;

    /** key = participantId + '|' + messageId */
    private final Map<String, Long> seenIds = new ConcurrentHashMap<>();
    /** key = participantId + '|' + 文本前缀 */
    private final Map<String, TextEntry> seenTexts = new ConcurrentHashMap<>();

    private final Counter suppressedById;
    private final Counter suppressedByText;

    public MessageDeduplicator(DedupProperties props,
                               Clock clock,
                               @Qualifier("gatewayScheduler") ScheduledExecutorService scheduler,
                               MeterRegistry registry) {
        this.props = props;
        this.clock = clock;
        this.scheduler = scheduler;
        this.suppressedById = Counter.builder("gateway.dedup.suppressed")
                .tag("by", "message_id")
                .description("Inbound messages dropped as replays of a seen message id")
                .register(registry);
        this.suppressedByText = Counter.builder("gateway.dedup.suppressed")
                .tag("by", "text")
                .description("Inbound messages dropped as duplicate text within the short window")
                .register(registry);
        Gauge.builder("gateway.dedup.entries", this, MessageDeduplicator::size)
                .description("Live entries in the dedup cache")
                .register(registry);
    }

    @PostConstruct
    void startSweeper() {
        long period = Math.max(1_000, props.getSweepIntervalMs());
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                sweep();
            } catch (Exception e) {
                log.warn("[Dedup] sweep failed: {}", e.toString());
            }
        }, period, period, TimeUnit.MILLISECONDS);
    }

    /**
     * @return true 表示是重复消息，调用方应直接丢弃
     */
    public boolean shouldSuppress(String participantId, String messageId, String text) {
        long now = clock.millis();
        String idKey = participantId + "|" + messageId;
        String body = text == null ? "" : text;
        String textKey = participantId + "|" + prefix(body);

        // ① 同一 messageId：原子占位，只有第一个调用者拿到 null
        Long[] previous = new Long[1];
        seenIds.compute(idKey, (k, ts) -> {
            if (ts != null && now - ts < props.getTtlMs()) {
                previous[0] = ts;
                return ts;
            }
            return now;
        });
        if (previous[0] != null) {
            suppressedById.increment();
            log.info("[Dedup] duplicate message id: participant={}, messageId={}", participantId, messageId);
            return true;
        }

        // ② 短窗口内相同文本（不同 messageId）
        boolean[] duplicateText = new boolean[1];
        seenTexts.compute(textKey, (k, e) -> {
            if (e != null && now - e.ts() < props.getTextWindowMs() && e.text().equals(body)) {
                duplicateText[0] = true;
                return e;
            }
            return new TextEntry(body, now);
        });
        if (duplicateText[0]) {
            // 该 messageId 已被 ① 记下，保留即可：之后同 id 重放也会被抑制
            suppressedByText.increment();
            log.info("[Dedup] duplicate text from participant {} within {} ms", participantId, props.getTextWindowMs());
            return true;
        }
        return false;
    }

    /** 清掉所有超过 TTL 的条目 */
    public void sweep() {
        long now = clock.millis();
        long ttl = props.getTtlMs();
        int before = size();
        seenIds.entrySet().removeIf(e -> now - e.getValue() >= ttl);
        seenTexts.entrySet().removeIf(e -> now - e.getValue().ts() >= ttl);
        int removed = before - size();
        if (removed > 0) {
            log.debug("[Dedup] swept {} expired entries", removed);
        }
    }

    public int size() {
        return seenIds.size() + seenTexts.size();
    }

    private String prefix(String text) {
        int n = Math.max(1, props.getTextPrefixLength());
        return text.length() <= n ? text : text.substring(0, n);
    }

    private record TextEntry(String text, long ts) {}
}
