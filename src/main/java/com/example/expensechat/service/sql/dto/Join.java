package com.example.expensechat.service.sql.dto;

/** JOIN tới một bảng sở hữu; {@code on} có thể null khi LLM viết JOIN thiếu điều kiện. */
public record Join(OwnedTable table, String on) {

    public String render() {
        String head = "JOIN " + table.tableName() + " " + table.alias();
        return on == null ? head : head + " ON " + on;
    }
}
