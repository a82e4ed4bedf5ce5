package com.jz.gateway.chat.tokens;

import com.jz.gateway.config.MemoryProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TokenizerConfig {
    @Bean
    public Tokenizer tokenizer(MemoryProperties props) {
        return new CharRatioTokenizer(props.getCharsPerToken());
    }
}
