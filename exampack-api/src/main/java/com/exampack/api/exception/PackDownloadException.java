package com.exampack.api.exception;

/**
 * 内容包下载异常
 * <p>
 * 网络错误、超时或主动取消均通过 {@link Reason} 区分，框架内部不做重试。
 */
public class PackDownloadException extends PackException {

    public enum Reason {
        /** 网络或服务端错误 */
        NETWORK,
        /** 超过下载时限 */
        TIMEOUT,
        /** 调用方主动取消 */
        CANCELLED,
        /** 同一内容包发起了新的下载 */
        SUPERSEDED
    }

    private final String packId;
    private final Reason reason;

    public PackDownloadException(String packId, Reason reason, String message) {
        super(message);
        this.packId = packId;
        this.reason = reason;
    }

    public PackDownloadException(String packId, Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.packId = packId;
        this.reason = reason;
    }

    public String getPackId() {
        return packId;
    }

    public Reason getReason() {
        return reason;
    }
}
