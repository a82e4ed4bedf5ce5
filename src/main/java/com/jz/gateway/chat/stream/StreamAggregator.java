package com.jz.gateway.chat.stream;

import com.jz.gateway.config.GenerationProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 把增量 token 流聚合成：
 * - 节流的中间结果（累计长度每跨过一个字符步长推一次，给调用方“原地编辑消息”用）；
 * - 一个最终文本。
 * 整个调用受显式截止时间约束；超时与流错误分别返回，不混为一谈。
 */
@Slf4j
@Component
public class StreamAggregator {

    private final TokenFeed feed;
    private final GenerationProperties props;
    private final MeterRegistry registry;
    private final Counter partialCounter;
    private final Counter malformedCounter;

    public StreamAggregator(TokenFeed feed, GenerationProperties props, MeterRegistry registry) {
        this.feed = feed;
        this.props = props;
        this.registry = registry;
        this.partialCounter = Counter.builder("gateway.stream.partial.count")
                .description("Partial-text notifications emitted while streaming")
                .register(registry);
        this.malformedCounter = Counter.builder("gateway.stream.malformed.count")
                .description("Token events skipped because they could not be read")
                .register(registry);
    }

    public GenerationOutcome generate(GenerationRequest request) {
        return generate(request, GenerationObserver.NONE);
    }

    public GenerationOutcome generate(GenerationRequest request, GenerationObserver observer) {
        Duration timeout = request.getTimeout() != null
                ? request.getTimeout()
                : Duration.ofMillis(props.getTimeoutMs());
        GenerationObserver obs = observer == null ? GenerationObserver.NONE : observer;
        StringBuffer buffer = new StringBuffer();
        AtomicInteger lastBucket = new AtomicInteger(0);
        int step = Math.max(1, props.getPartialUpdateEveryChars());
        Timer.Sample sample = Timer.start(registry);

        // 整体截止时间：每个 item 之后只等“剩余时间”，而不是两个 item 之间的固定间隔
        long deadlineNanos = System.nanoTime() + timeout.toNanos();
        Mono<Long> remaining = Mono.defer(() ->
                Mono.delay(Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()))));

        GenerationOutcome outcome;
        try {
            Flux.defer(() -> feed.open(request))
                    .takeUntil(TokenEvent::isTerminal)
                    .timeout(remaining, ev -> remaining)
                    .doOnNext(ev -> accept(ev, buffer, lastBucket, step, obs))
                    .blockLast();
            String text = buffer.toString();
            outcome = GenerationOutcome.completed(text);
            notifyFinal(obs, text);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            String partial = buffer.toString();
            if (cause instanceof TimeoutException) {
                log.warn("[Stream] {} generation timed out after {} ms, partial length={}",
                        request.getPurpose(), timeout.toMillis(), partial.length());
                outcome = GenerationOutcome.timeout(partial, timeout);
            } else {
                log.error("[Stream] {} stream error after {} chars: {}",
                        request.getPurpose(), partial.length(), cause.toString());
                outcome = GenerationOutcome.streamError(partial, cause);
            }
        }

        sample.stop(Timer.builder("gateway.stream.latency")
                .tag("purpose", String.valueOf(request.getPurpose()))
                .tag("status", outcome.getStatus().name())
                .register(registry));
        return outcome;
    }

    private void accept(TokenEvent ev, StringBuffer buffer, AtomicInteger lastBucket,
                        int step, GenerationObserver obs) {
        switch (ev.kind()) {
            case MALFORMED -> {
                malformedCounter.increment();
                log.warn("[Stream] skip malformed event: {}", abbreviate(ev.raw()));
            }
            case END -> log.debug("[Stream] end of stream, total length={}", buffer.length());
            case TOKEN -> {
                if (ev.fragment() == null || ev.fragment().isEmpty()) return;
                buffer.append(ev.fragment());
                int bucket = buffer.length() / step;
                if (bucket > lastBucket.get()) {
                    lastBucket.set(bucket);
                    partialCounter.increment();
                    notifyPartial(obs, buffer.toString());
                }
            }
        }
    }

    // 回调失败（如平台编辑限流）不能中断聚合
    private void notifyPartial(GenerationObserver obs, String text) {
        try {
            obs.onPartial(text);
        } catch (Exception e) {
            log.warn("[Stream] partial update callback failed: {}", e.toString());
        }
    }

    private void notifyFinal(GenerationObserver obs, String text) {
        try {
            obs.onFinal(text);
        } catch (Exception e) {
            log.warn("[Stream] final callback failed: {}", e.toString());
        }
    }

    private static String abbreviate(String s) {
        if (s == null) return "null";
        return s.length() <= 120 ? s : s.substring(0, 120) + "...";
    }
}
