package com.exampack.api.exception;

/**
 * 内容包异常基类
 * <p>
 * 所有框架抛出的异常均为非受检异常，调用方可按子类型区分处理。
 */
public class PackException extends RuntimeException {

    public PackException(String message) {
        super(message);
    }

    public PackException(String message, Throwable cause) {
        super(message, cause);
    }
}
