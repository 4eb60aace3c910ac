package com.example.expensechat.exception;

import com.example.expensechat.config.ErrorConfig;
import lombok.Getter;

@Getter
public class ValidationException extends GatewayException {
    private final String field;
    private final String value;

    public ValidationException(String field, String value, String message) {
        super(ErrorConfig.VALIDATION_ERROR, message);
        this.field = field;
        this.value = value;
    }
}
