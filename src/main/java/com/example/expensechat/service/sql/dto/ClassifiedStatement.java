package com.example.expensechat.service.sql.dto;

/**
 * Biến thể đóng được quyết định một lần tại bộ phân loại.
 * Các tầng sau chỉ dựa vào biến thể, không đọc lại text SQL gốc.
 */
public sealed interface ClassifiedStatement
        permits InsertStatement, UpdateStatement, SelectStatement, UnsupportedStatement {

    StatementKind kind();
}
