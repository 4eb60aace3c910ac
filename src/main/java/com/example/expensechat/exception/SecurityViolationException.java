package com.example.expensechat.exception;

import com.example.expensechat.config.ErrorConfig;
import lombok.Getter;

@Getter
public class SecurityViolationException extends GatewayException {
    private final String offendingToken;

    public SecurityViolationException(String offendingToken, String message) {
        super(ErrorConfig.SECURITY_VIOLATION, message);
        this.offendingToken = offendingToken;
    }
}
