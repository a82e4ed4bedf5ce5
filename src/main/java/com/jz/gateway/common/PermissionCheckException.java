package com.jz.gateway.common;

/** 管理员/成员身份查询失败。调用方默认按“非管理员/非成员”处理。 */
public class PermissionCheckException extends RuntimeException {

    public PermissionCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
