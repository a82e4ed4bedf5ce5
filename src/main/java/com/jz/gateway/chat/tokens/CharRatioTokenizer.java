package com.jz.gateway.chat.tokens;

/** 经验估算：N 个字符 ≈ 1 token（默认 4），向上取整。 */
public class CharRatioTokenizer implements Tokenizer {

    private final int charsPerToken;

    public CharRatioTokenizer(int charsPerToken) {
        this.charsPerToken = Math.max(1, charsPerToken);
    }

    @Override
    public int countText(String s) {
        if (s == null || s.isEmpty()) return 0;
        return (s.length() + charsPerToken - 1) / charsPerToken;
    }

    @Override
    public int maxChars(int tokenBudget) {
        return tokenBudget <= 0 ? 0 : tokenBudget * charsPerToken;
    }
}
