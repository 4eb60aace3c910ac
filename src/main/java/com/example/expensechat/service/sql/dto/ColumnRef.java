package com.example.expensechat.service.sql.dto;

/** Cột đã được chuẩn hoá về bảng sở hữu (alias b / c / e). */
public record ColumnRef(OwnedTable table, String column) {

    public boolean is(String name) {
        return column.equalsIgnoreCase(name);
    }

    public String qualified() {
        return table.alias() + "." + column;
    }
}
