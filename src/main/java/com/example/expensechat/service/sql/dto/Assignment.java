package com.example.expensechat.service.sql.dto;

public record Assignment(String column, SqlValue value) {
}
