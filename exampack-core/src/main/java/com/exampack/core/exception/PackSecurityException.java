package com.exampack.core.exception;

import com.exampack.api.exception.PackException;

/**
 * 内容包安全异常
 * <p>
 * 用于签名、公钥等完整性校验相关的致命错误。
 */
public class PackSecurityException extends PackException {

    private final String packId;

    public PackSecurityException(String packId, String message) {
        super(message);
        this.packId = packId;
    }

    public PackSecurityException(String packId, String message, Throwable cause) {
        super(message, cause);
        this.packId = packId;
    }

    public String getPackId() {
        return packId;
    }
}
