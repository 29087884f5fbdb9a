package com.exampack.api.exception;

/**
 * 无效参数异常
 * 当传入的参数不满足业务要求时抛出此异常。
 */
public class InvalidArgumentException extends PackException {

    private final String paramName;
    private final Object invalidValue;

    public InvalidArgumentException(String message) {
        super(message);
        this.paramName = null;
        this.invalidValue = null;
    }

    public InvalidArgumentException(String paramName, String message) {
        super(message);
        this.paramName = paramName;
        this.invalidValue = null;
    }

    public InvalidArgumentException(String paramName, Object invalidValue, String message) {
        super(message);
        this.paramName = paramName;
        this.invalidValue = invalidValue;
    }

    public InvalidArgumentException(String paramName, String message, Throwable cause) {
        super(message, cause);
        this.paramName = paramName;
        this.invalidValue = null;
    }

    public String getParamName() {
        return paramName;
    }

    public Object getInvalidValue() {
        return invalidValue;
    }
}
