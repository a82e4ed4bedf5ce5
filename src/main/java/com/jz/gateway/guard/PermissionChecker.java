package com.jz.gateway.guard;

/**
 * 群权限查询。实现方失败时抛 {@link com.jz.gateway.common.PermissionCheckException}。
 */
public interface PermissionChecker {

    boolean isAdmin(String participantId, String chatId);

    boolean isMember(String participantId, String chatId);
}
