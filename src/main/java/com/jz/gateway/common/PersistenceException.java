package com.jz.gateway.common;

/** 存储读写失败（Redis / MySQL）。调用方记录日志后按 no-op 继续。 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
