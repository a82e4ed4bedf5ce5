package com.jz.gateway.guard;

import com.jz.gateway.common.PermissionCheckException;
import lombok.extern.slf4j.Slf4j;

/**
 * 一条消息生命周期内的权限结论。admin 在创建时确定；
 * member 只在需要时（封禁后复入群检查）查一次并缓存。
 * 查询失败一律按 false 处理。
 */
@Slf4j
public class MessageAuthorization {

    private final String participantId;
    private final String chatId;
    private final boolean admin;
    private final PermissionChecker checker;
    private Boolean member;

    MessageAuthorization(String participantId, String chatId, boolean admin, PermissionChecker checker) {
        this.participantId = participantId;
        this.chatId = chatId;
        this.admin = admin;
        this.checker = checker;
    }

    /** 私聊或测试用：不是管理员，成员查询恒为给定值 */
    public static MessageAuthorization fixed(String participantId, String chatId, boolean admin, boolean member) {
        MessageAuthorization a = new MessageAuthorization(participantId, chatId, admin, null);
        a.member = member;
        return a;
    }

    public boolean isAdmin() {
        return admin;
    }

    public synchronized boolean isMember() {
        if (member == null) {
            try {
                member = checker.isMember(participantId, chatId);
            } catch (PermissionCheckException e) {
                log.warn("[Moderation] membership check failed for {} in {}, assuming not a member: {}",
                        participantId, chatId, e.getMessage());
                member = false;
            }
        }
        return member;
    }

    public String participantId() {
        return participantId;
    }

    public String chatId() {
        return chatId;
    }
}
