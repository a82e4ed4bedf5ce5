package com.jz.gateway.config;

import com.jz.gateway.domain.entity.AgentProfile;
import com.jz.gateway.service.AgentProfileService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class AgentBootstrap implements CommandLineRunner {

    private final AgentProfileService agentService;
    private final GenerationProperties generationProps;

    @Override
    public void run(String... args) {
        // 已有默认 agent 则跳过
        if (agentService.lambdaQuery().eq(AgentProfile::getIsDefault, 1).count() > 0) return;

        AgentProfile a = new AgentProfile();
        a.setCode("AGT-001");
        a.setName("Gateway Assistant");
        a.setRole("General-purpose chat assistant and group moderator");
        a.setDescription("Answers questions in private chats and keeps group discussions civil.");
        a.setInstructions("Keep answers short and concrete. Ask a clarifying question when the request is ambiguous.");
        a.setSystemPrompt("You are a helpful assistant talking to people through a chat app.");
        a.setModel(generationProps.getDefaultModel());
        a.setModerationEnabled(1);
        a.setIsDefault(1);
        a.setPromptServed(0L);
        a.setAverageResponseTime(0L);
        agentService.save(a);
        log.info("[Agent] seeded default agent {} ({})", a.getId(), a.getCode());
    }
}
