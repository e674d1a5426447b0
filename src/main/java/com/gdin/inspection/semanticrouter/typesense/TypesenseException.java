package com.gdin.inspection.semanticrouter.typesense;

import lombok.Getter;

/**
 * Typesense 调用失败(不可达、超时、响应无法解析、非预期状态码), 由 SDK 的受检异常转换而来
 */
@Getter
public class TypesenseException extends RuntimeException {
    // 0 表示状态码未知(连接失败或 SDK 未给出)
    private final int status;

    public TypesenseException(int status, String message) {
        super(message);
        this.status = status;
    }

    public TypesenseException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
