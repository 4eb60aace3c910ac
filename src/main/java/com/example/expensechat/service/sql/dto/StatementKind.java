package com.example.expensechat.service.sql.dto;

public enum StatementKind {
    INSERT,
    UPDATE,
    SELECT,
    UNSUPPORTED
}
