package com.example.expensechat.config;

public final class ErrorConfig {
    private ErrorConfig() {}
    public static final String INTERNAL_SERVER_ERROR = "INTERNAL_SERVER_ERROR";
    public static final String NO_DATA_FOUND = "NO_DATA_FOUND";
    public static final String BAD_REQUEST = "BAD_REQUEST";
    public static final String SECURITY_VIOLATION = "SECURITY_VIOLATION";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String DUPLICATE_ENTITY = "DUPLICATE_ENTITY";
    public static final String UPSTREAM_UNAVAILABLE = "UPSTREAM_UNAVAILABLE";
    public static final String EXECUTION_FAILURE = "EXECUTION_FAILURE";
}
