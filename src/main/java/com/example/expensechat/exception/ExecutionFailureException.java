package com.example.expensechat.exception;

import com.example.expensechat.config.ErrorConfig;

public class ExecutionFailureException extends GatewayException {

    public ExecutionFailureException(String message, Throwable cause) {
        super(ErrorConfig.EXECUTION_FAILURE, message, cause);
    }
}
