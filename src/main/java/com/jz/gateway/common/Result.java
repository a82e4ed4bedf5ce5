package com.jz.gateway.common;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** 网关 REST 响应包装：code 沿用 HTTP 语义（200 / 400 / 500 / 503） */
@Data
@NoArgsConstructor
@AllArgsConstructor(staticName = "of")
public class Result<T> {
    private Integer code;
    private String message;
    private T data;

    public static <T> Result<T> success(T data) {
        return of(200, "success", data);
    }

    public static <T> Result<T> badRequest(String msg) {
        return of(400, msg, null);
    }

    /** 依赖（Redis 等）不可用 */
    public static <T> Result<T> error(String msg) {
        return of(500, msg, null);
    }

    /** 处理线程池已满，客户端稍后重投 */
    public static <T> Result<T> busy(String msg) {
        return of(503, msg, null);
    }

    @JsonIgnore
    public boolean isOk() {
        return code != null && code == 200;
    }
}
