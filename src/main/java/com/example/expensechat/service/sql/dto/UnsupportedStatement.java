package com.example.expensechat.service.sql.dto;

/** Câu lệnh không thuộc INSERT/UPDATE/SELECT: chỉ báo lỗi, không bao giờ thực thi. */
public record UnsupportedStatement(String sql, String verb) implements ClassifiedStatement {

    @Override
    public StatementKind kind() {
        return StatementKind.UNSUPPORTED;
    }
}
