package com.example.expensechat.exception;

/**
 * Gốc của các lỗi trong pipeline SQL: mỗi lỗi chỉ làm hỏng câu lệnh hiện tại,
 * trừ {@link SecurityViolationException} (huỷ cả phản hồi của LLM).
 */
public abstract class GatewayException extends AppException {

    protected GatewayException(String errorCode, String message) {
        super(errorCode, message);
    }

    protected GatewayException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
