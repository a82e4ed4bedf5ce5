package com.jz.gateway.service.impl;

import com.jz.gateway.domain.entity.ModerationEvent;
import com.jz.gateway.guard.warning.SanctionAction;
import com.jz.gateway.guard.warning.WarningKey;
import com.jz.gateway.mapper.ModerationEventMapper;
import com.jz.gateway.service.ModerationLogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class ModerationLogServiceImpl implements ModerationLogService {

    private final ModerationEventMapper eventMapper;

    @Override
    @Async("chatAsyncExecutor")
    public void record(WarningKey key, SanctionAction action, int warningCount, String reason, String issuerId) {
        ModerationEvent e = new ModerationEvent();
        e.setParticipantId(key.participantId());
        e.setChatId(key.chatId());
        e.setAction(action.code());
        e.setWarningCount(warningCount);
        e.setReason(reason == null ? null : (reason.length() > 256 ? reason.substring(0, 256) : reason));
        e.setIssuerId(issuerId);
        try {
            eventMapper.insert(e);
        } catch (Exception ex) {
            log.warn("[Warning] moderation event not logged for {}: {}", key.id(), ex.getMessage());
        }
    }
}
