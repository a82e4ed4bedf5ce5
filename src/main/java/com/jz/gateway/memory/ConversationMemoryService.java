package com.jz.gateway.memory;

import com.jz.gateway.chat.tokens.Tokenizer;
import com.jz.gateway.common.PersistenceException;
import com.jz.gateway.common.StripedLocks;
import com.jz.gateway.config.MemoryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 有界会话记忆：
 * - 原始消息超过触发阈值后，旧的部分压缩进 summary，只保留最近 K 条；
 * - buildContext 在 token 预算内拼出“摘要 + 最近消息”；
 * - 同一会话的读-改-写按 key 串行化，模型调用不在锁内进行。
 */
@Slf4j
@Service
public class ConversationMemoryService {

    static final String SUMMARY_LABEL = "Summary of earlier conversation: ";
    static final String HISTORY_SUMMARY_LABEL = "Previous conversation summary: ";
    static final String ELLIPSIS = "...";

    private final ConversationStore store;
    private final Summarizer summarizer;
    private final ExtractiveSummarizer fallback;
    private final Tokenizer tokenizer;
    private final MemoryProperties props;
    private final Clock clock;
    private final Executor summaryExecutor;

    private final StripedLocks locks = new StripedLocks(64);
    /** 已排队但未完成的摘要任务，同一会话同时只排一个 */
    private final Set<String> pendingSummaries = ConcurrentHashMap.newKeySet();

    public ConversationMemoryService(ConversationStore store,
                                     Summarizer summarizer,
                                     ExtractiveSummarizer fallback,
                                     Tokenizer tokenizer,
                                     MemoryProperties props,
                                     Clock clock,
                                     @Qualifier("summaryExecutor") Executor summaryExecutor) {
        this.store = store;
        this.summarizer = summarizer;
        this.fallback = fallback;
        this.tokenizer = tokenizer;
        this.props = props;
        this.clock = clock;
        this.summaryExecutor = summaryExecutor;
    }

    /**
     * 追加一条消息。空白内容、或与上一条完全相同（角色 + 内容）的消息不落库。
     *
     * @return 是否真的追加了
     */
    public boolean recordMessage(ConversationKey key, MessageRole role, String content) {
        if (content == null || content.isBlank()) {
            log.debug("[Memory] skip blank {} message for {}", role, key.id());
            return false;
        }
        String text = content.trim();
        int size;
        try {
            size = locks.withLock(key.id(), () -> {
                long now = clock.millis();
                ConversationDoc doc = store.findOne(key).orElseGet(() -> ConversationDoc.create(key, now));
                List<StoredMessage> msgs = doc.getMessages();
                if (!msgs.isEmpty()) {
                    StoredMessage last = msgs.get(msgs.size() - 1);
                    if (last.getRole() == role && text.equals(last.getContent())) {
                        return -1;
                    }
                }
                msgs.add(StoredMessage.of(role, text, now));
                doc.setLastActive(now);
                store.upsert(doc);
                return msgs.size();
            });
        } catch (PersistenceException e) {
            log.error("[Memory] record failed for {}: {}", key.id(), e.getMessage());
            return false;
        }
        if (size < 0) {
            log.debug("[Memory] skip repeated {} message for {}", role, key.id());
            return false;
        }
        if (size > props.getSummarizeTriggerCount()) {
            scheduleSummarize(key);
        }
        return true;
    }

    /**
     * 在 tokenBudget 内拼上下文：先摘要，再按时间顺序的最近消息；放不下时丢最旧的。
     * 没有摘要且最新一条都放不下时，按字符截断最新一条。
     */
    public String buildContext(ConversationKey key, int tokenBudget) {
        int limit = tokenizer.maxChars(tokenBudget);
        if (limit <= 0) return "";
        Optional<ConversationDoc> found;
        try {
            found = store.findOne(key);
        } catch (PersistenceException e) {
            log.warn("[Memory] context unavailable for {}: {}", key.id(), e.getMessage());
            return "";
        }
        if (found.isEmpty()) return "";
        ConversationDoc doc = found.get();

        StringBuilder out = new StringBuilder();
        if (doc.hasSummary()) {
            out.append(truncate(SUMMARY_LABEL + doc.getSummary() + "\n\n", limit));
        }

        List<StoredMessage> valid = doc.getMessages().stream().filter(StoredMessage::hasContent).toList();
        List<String> picked = new ArrayList<>();
        int used = out.length();
        for (int i = valid.size() - 1; i >= 0; i--) {
            String line = line(valid.get(i));
            if (used + line.length() > limit) break;
            picked.add(line);
            used += line.length();
        }

        if (picked.isEmpty() && !valid.isEmpty() && !doc.hasSummary()) {
            StoredMessage newest = valid.get(valid.size() - 1);
            String head = newest.getRole().label() + ": ";
            int room = limit - head.length() - ELLIPSIS.length();
            if (room > 0) {
                out.append(head).append(newest.getContent(), 0, Math.min(room, newest.getContent().length())).append(ELLIPSIS);
            }
            return out.toString();
        }

        Collections.reverse(picked);
        picked.forEach(out::append);
        return out.toString();
    }

    public String buildContext(ConversationKey key) {
        return buildContext(key, props.getContextTokenBudget());
    }

    /**
     * 把除最近 K 条外的消息压缩进 summary。模型失败时用抽取式摘要兜底。
     * 模型调用期间不持锁；回写时若会话已被清空或改写，则放弃本次结果。
     *
     * @return 是否改动了会话
     */
    public boolean summarize(ConversationKey key) {
        String id = key.id();
        int keep = Math.max(0, props.getSummarizeKeepCount());
        List<StoredMessage> old;
        try {
            old = locks.withLock(id, () -> {
                List<StoredMessage> msgs = store.findOne(key).map(ConversationDoc::getMessages).orElse(List.of());
                if (msgs.size() <= keep) return List.<StoredMessage>of();
                return List.copyOf(msgs.subList(0, msgs.size() - keep));
            });
        } catch (PersistenceException e) {
            log.warn("[Memory] summarize skipped for {}: {}", id, e.getMessage());
            return false;
        }
        if (old.isEmpty()) return false;

        List<StoredMessage> valid = old.stream().filter(StoredMessage::hasContent).toList();
        String body = null;
        if (!valid.isEmpty()) {
            try {
                body = summarizer.summarize(valid);
            } catch (RuntimeException e) {
                log.warn("[Memory] summarizer failed for {}, using extractive fallback: {}", id, e.getMessage());
            }
            if (body == null || body.isBlank()) {
                body = fallback.summarize(valid);
            }
        }
        String entry = body == null ? null : valid.size() + " earlier messages summarized: " + body.trim();

        try {
            return locks.withLock(id, () -> {
                Optional<ConversationDoc> found = store.findOne(key);
                if (found.isEmpty()) return false;
                ConversationDoc doc = found.get();
                List<StoredMessage> msgs = doc.getMessages();
                if (msgs.size() < old.size() || !msgs.subList(0, old.size()).equals(old)) {
                    log.info("[Memory] conversation {} changed while summarizing, result dropped", id);
                    return false;
                }
                doc.setMessages(new ArrayList<>(msgs.subList(old.size(), msgs.size())));
                if (entry != null) {
                    doc.setSummary(doc.hasSummary() ? doc.getSummary() + "\n\n" + entry : entry);
                }
                store.upsert(doc);
                log.info("[Memory] summarized {} messages for {}, kept {}", old.size(), id, doc.getMessages().size());
                return true;
            });
        } catch (PersistenceException e) {
            log.error("[Memory] summary write-back failed for {}: {}", id, e.getMessage());
            return false;
        }
    }

    /** 清空消息与摘要。会话不存在时什么也不做。 */
    public boolean clear(ConversationKey key) {
        try {
            return locks.withLock(key.id(), () -> {
                Optional<ConversationDoc> found = store.findOne(key);
                if (found.isEmpty()) return false;
                ConversationDoc doc = found.get();
                doc.setMessages(new ArrayList<>());
                doc.setSummary("");
                doc.setLastActive(clock.millis());
                store.upsert(doc);
                log.info("[Memory] cleared {}", key.id());
                return true;
            });
        } catch (PersistenceException e) {
            log.error("[Memory] clear failed for {}: {}", key.id(), e.getMessage());
            return false;
        }
    }

    /** 最近 limit 条消息；有摘要时在最前面放一条 system 消息。 */
    public List<StoredMessage> history(ConversationKey key, int limit) {
        Optional<ConversationDoc> found = find(key);
        if (found.isEmpty()) return List.of();
        ConversationDoc doc = found.get();
        List<StoredMessage> msgs = doc.getMessages();
        int n = Math.max(0, limit);
        List<StoredMessage> out = new ArrayList<>();
        if (doc.hasSummary()) {
            out.add(StoredMessage.of(MessageRole.SYSTEM, HISTORY_SUMMARY_LABEL + doc.getSummary(), doc.getLastActive()));
        }
        out.addAll(msgs.subList(Math.max(0, msgs.size() - n), msgs.size()));
        return out;
    }

    public List<StoredMessage> history(ConversationKey key) {
        return history(key, props.getHistoryLimit());
    }

    public Optional<ConversationDoc> find(ConversationKey key) {
        try {
            return store.findOne(key);
        } catch (PersistenceException e) {
            log.warn("[Memory] conversation unavailable for {}: {}", key.id(), e.getMessage());
            return Optional.empty();
        }
    }

    void scheduleSummarize(ConversationKey key) {
        String id = key.id();
        if (!pendingSummaries.add(id)) return;
        try {
            summaryExecutor.execute(() -> {
                try {
                    summarize(key);
                } catch (RuntimeException e) {
                    log.error("[Memory] background summarize failed for {}", id, e);
                } finally {
                    pendingSummaries.remove(id);
                }
            });
        } catch (RejectedExecutionException e) {
            pendingSummaries.remove(id);
            log.warn("[Memory] summarize rejected for {}, will retry on next message", id);
        }
    }

    private static String line(StoredMessage m) {
        return m.getRole().label() + ": " + m.getContent() + "\n\n";
    }

    private static String truncate(String s, int limit) {
        if (s.length() <= limit) return s;
        if (limit <= ELLIPSIS.length()) return s.substring(0, limit);
        return s.substring(0, limit - ELLIPSIS.length()) + ELLIPSIS;
    }
}
