package com.jz.gateway.chat.stream;

import com.jz.gateway.common.GenerationTimeoutException;
import com.jz.gateway.common.StreamErrorException;
import com.jz.gateway.config.GenerationProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StreamAggregatorTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    private StreamAggregator aggregator(TokenFeed feed) {
        return new StreamAggregator(feed, new GenerationProperties(), registry);
    }

    private static GenerationRequest request(Duration timeout) {
        return GenerationRequest.builder().userPrompt("hi").timeout(timeout).build();
    }

    @Test
    void finalTextIsExactConcatenationOfFragments() {
        TokenFeed feed = req -> Flux.just(
                TokenEvent.token("Hello"), TokenEvent.token(", "), TokenEvent.token("world"), TokenEvent.end());

        GenerationOutcome out = aggregator(feed).generate(request(Duration.ofSeconds(5)));

        assertTrue(out.isCompleted());
        assertEquals("Hello, world", out.getText());
        assertEquals("Hello, world", out.textOrThrow());
    }

    @Test
    void partialUpdatesAreThrottledByCharacterStep() {
        List<TokenEvent> events = new ArrayList<>(Collections.nCopies(10, TokenEvent.token("abcde")));
        events.add(TokenEvent.end());
        List<Integer> partialLengths = new ArrayList<>();
        List<String> finals = new ArrayList<>();
        GenerationObserver obs = new GenerationObserver() {
            @Override
            public void onPartial(String textSoFar) {
                partialLengths.add(textSoFar.length());
            }

            @Override
            public void onFinal(String finalText) {
                finals.add(finalText);
            }
        };

        GenerationOutcome out = aggregator(req -> Flux.fromIterable(events)).generate(request(Duration.ofSeconds(5)), obs);

        assertEquals(50, out.getText().length());
        assertEquals(List.of(20, 40), partialLengths);
        assertEquals(List.of(out.getText()), finals);
    }

    @Test
    void malformedEventsAreSkipped() {
        TokenFeed feed = req -> Flux.just(
                TokenEvent.token("a"), TokenEvent.malformed("{broken"), TokenEvent.token("b"), TokenEvent.end());

        GenerationOutcome out = aggregator(feed).generate(request(Duration.ofSeconds(5)));

        assertEquals("ab", out.getText());
        assertEquals(1.0, registry.get("gateway.stream.malformed.count").counter().count());
    }

    @Test
    void onlyEndSentinelTerminatesTheStream() {
        TokenFeed feed = req -> Flux.just(
                TokenEvent.lastToken("a"), TokenEvent.token("b"), TokenEvent.end(), TokenEvent.token("never"));

        GenerationOutcome out = aggregator(feed).generate(request(Duration.ofSeconds(5)));

        assertTrue(out.isCompleted());
        assertEquals("ab", out.getText());
    }

    @Test
    void streamErrorKeepsAccumulatedText() {
        TokenFeed feed = req -> Flux.concat(
                Flux.just(TokenEvent.token("partial ")),
                Flux.error(new IllegalStateException("connection reset")));

        GenerationOutcome out = aggregator(feed).generate(request(Duration.ofSeconds(5)));

        assertEquals(GenerationOutcome.Status.STREAM_ERROR, out.getStatus());
        assertEquals("partial ", out.getText());
        StreamErrorException ex = assertThrows(StreamErrorException.class, out::textOrThrow);
        assertEquals("partial ", ex.getPartialText());
    }

    @Test
    void feedThatFailsToOpenIsAStreamError() {
        TokenFeed feed = req -> {
            throw new IllegalStateException("no client");
        };

        GenerationOutcome out = aggregator(feed).generate(request(Duration.ofSeconds(5)));

        assertEquals(GenerationOutcome.Status.STREAM_ERROR, out.getStatus());
        assertEquals("", out.getText());
    }

    @Test
    void deadlineProducesTimeoutDistinctFromStreamError() {
        TokenFeed feed = req -> Flux.just(TokenEvent.token("slow")).concatWith(Flux.never());

        GenerationOutcome out = aggregator(feed).generate(request(Duration.ofMillis(150)));

        assertEquals(GenerationOutcome.Status.TIMEOUT, out.getStatus());
        assertEquals("slow", out.getText());
        assertEquals(Duration.ofMillis(150), out.getTimeout());
        assertThrows(GenerationTimeoutException.class, out::textOrThrow);
    }

    @Test
    void deadlineCoversTheWholeCallNotJustGapsBetweenTokens() {
        // 每 40ms 一个 token，单个间隔永远小于 150ms，但整体超过截止时间
        TokenFeed feed = req -> Flux.interval(Duration.ofMillis(40)).map(i -> TokenEvent.token("x"));

        GenerationOutcome out = aggregator(feed).generate(request(Duration.ofMillis(150)));

        assertEquals(GenerationOutcome.Status.TIMEOUT, out.getStatus());
        assertTrue(out.getText().length() <= 4);
    }

    @Test
    void failingObserverDoesNotAbortAggregation() {
        List<TokenEvent> events = new ArrayList<>(Collections.nCopies(5, TokenEvent.token("0123456789")));
        events.add(TokenEvent.end());

        GenerationOutcome out = aggregator(req -> Flux.fromIterable(events)).generate(request(Duration.ofSeconds(5)),
                text -> {
                    throw new IllegalStateException("edit rate limited");
                });

        assertTrue(out.isCompleted());
        assertEquals(50, out.getText().length());
    }
}
