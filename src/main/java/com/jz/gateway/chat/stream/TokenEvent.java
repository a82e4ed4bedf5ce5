package com.jz.gateway.chat.stream;

/**
 * 增量生成流中的一个事件：
 * - TOKEN：一段文本片段，completed=true 表示上游标记的最后一片，仍以 END 为准；
 * - END：显式的流结束哨兵，只有它终止聚合；
 * - MALFORMED：无法解析的事件，聚合时跳过并记日志。
 */
public record TokenEvent(Kind kind, String fragment, boolean completed, String raw) {

    public enum Kind { TOKEN, END, MALFORMED }

    public static TokenEvent token(String fragment) {
        return new TokenEvent(Kind.TOKEN, fragment, false, null);
    }

    public static TokenEvent lastToken(String fragment) {
        return new TokenEvent(Kind.TOKEN, fragment, true, null);
    }

    public static TokenEvent end() {
        return new TokenEvent(Kind.END, null, true, null);
    }

    public static TokenEvent malformed(String raw) {
        return new TokenEvent(Kind.MALFORMED, null, false, raw);
    }

    /** 收到后聚合即终止 */
    public boolean isTerminal() {
        return kind == Kind.END;
    }
}
