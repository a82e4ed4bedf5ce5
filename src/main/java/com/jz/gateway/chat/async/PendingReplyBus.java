package com.jz.gateway.chat.async;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 默认的出站实现：发送和编辑都按 chat 排队，客户端通过 /api/gateway/pull 拉走。
 * 编辑只能针对本进程发出过的消息。每个 chat 最多积压 MAX_QUEUED 条，超出丢最旧的；拉空后队列即移除。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PendingReplyBus implements OutboundMessenger {

    private final Clock clock;

    // 单个 chat 的队列只在 compute 内读写
    private final Map<String, Deque<OutboundEvent>> box = new ConcurrentHashMap<>();
    /** messageId -> chatId，只记最近发出的一批 */
    private final Map<Long, String> sent = Collections.synchronizedMap(new LinkedHashMap<Long, String>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<Long, String> eldest) {
            return size() > MAX_TRACKED;
        }
    });
    static final int MAX_TRACKED = 10_000;
    static final int MAX_QUEUED = 500;
    private final AtomicLong ids = new AtomicLong();

    @Override
    public MessageHandle send(String chatId, String text) {
        long id = ids.incrementAndGet();
        sent.put(id, chatId);
        push(new OutboundEvent(OutboundEvent.Kind.SEND, chatId, id, text, clock.millis()));
        return new MessageHandle(chatId, id);
    }

    @Override
    public void edit(MessageHandle handle, String text) {
        if (!handle.chatId().equals(sent.get(handle.messageId()))) {
            throw new IllegalArgumentException("unknown message " + handle.messageId() + " in chat " + handle.chatId());
        }
        push(new OutboundEvent(OutboundEvent.Kind.EDIT, handle.chatId(), handle.messageId(), text, clock.millis()));
    }

    public List<OutboundEvent> pull(String chatId, int max) {
        List<OutboundEvent> out = new ArrayList<>();
        int n = Math.max(1, max);
        box.computeIfPresent(chatId, (k, q) -> {
            while (out.size() < n && !q.isEmpty()) {
                out.add(q.pollFirst());
            }
            return q.isEmpty() ? null : q;
        });
        return out;
    }

    /** 当前积压的 chat 数 */
    int pendingChats() {
        return box.size();
    }

    private void push(OutboundEvent e) {
        box.compute(e.getChatId(), (k, q) -> {
            Deque<OutboundEvent> queue = q == null ? new ArrayDeque<>() : q;
            queue.addLast(e);
            if (queue.size() > MAX_QUEUED) {
                OutboundEvent dropped = queue.pollFirst();
                log.warn("[Outbound] chat {} backlog over {}, dropped {} event for message {}",
                        k, MAX_QUEUED, dropped.getKind(), dropped.getMessageId());
            }
            return queue;
        });
    }
}
