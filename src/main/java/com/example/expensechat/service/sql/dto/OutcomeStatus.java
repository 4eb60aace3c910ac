package com.example.expensechat.service.sql.dto;

public enum OutcomeStatus {
    SUCCESS,
    FAILED,
    NEEDS_CATEGORY
}
