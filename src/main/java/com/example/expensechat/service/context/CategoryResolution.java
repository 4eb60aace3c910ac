package com.example.expensechat.service.context;

public enum CategoryResolution {
    RESOLVING,
    READY,
    NEEDS_CATEGORY,
    AWAITING_CONFIRMATION,
    ABANDONED
}
