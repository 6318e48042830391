package com.example.bilitracker.common.exception;

/**
 * Rejected user input: a malformed collection URL or an unsupported collection type.
 */
public class ValidationException extends BusinessException {

    public static final String CODE = "400";

    public ValidationException(String message) {
        super(CODE, message, "请检查输入的合集链接");
    }

    public ValidationException(String message, Throwable cause) {
        super(CODE, message, "请检查输入的合集链接", cause);
    }
}
