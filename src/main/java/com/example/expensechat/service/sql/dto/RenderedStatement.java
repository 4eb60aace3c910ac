package com.example.expensechat.service.sql.dto;

/** Text SQL cuối cùng, chỉ được tạo ra ở ranh giới Executor. */
public record RenderedStatement(StatementKind kind, OwnedTable table, String sql) {
}
