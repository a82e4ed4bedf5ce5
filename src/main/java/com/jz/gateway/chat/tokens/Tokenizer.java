package com.jz.gateway.chat.tokens;


public interface Tokenizer {
    int countText(String text);

    /** 预算 budget 个 token 时最多能放多少字符 */
    int maxChars(int tokenBudget);
}
