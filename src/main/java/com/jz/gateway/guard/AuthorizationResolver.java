package com.jz.gateway.guard;

import com.jz.gateway.common.PermissionCheckException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** 每条消息调用一次，结果交给审核和警告两个环节共用 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthorizationResolver {

    private final PermissionChecker checker;

    public MessageAuthorization resolve(String participantId, String chatId) {
        boolean admin;
        try {
            admin = checker.isAdmin(participantId, chatId);
        } catch (PermissionCheckException e) {
            log.warn("[Moderation] admin check failed for {} in {}, assuming not admin: {}",
                    participantId, chatId, e.getMessage());
            admin = false;
        }
        return new MessageAuthorization(participantId, chatId, admin, checker);
    }
}
