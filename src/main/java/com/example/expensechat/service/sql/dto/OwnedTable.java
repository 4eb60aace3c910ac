package com.example.expensechat.service.sql.dto;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Các bảng thuộc chuỗi sở hữu Expense → Category → Book → User.
 * Alias cố định được dùng khi dựng lại FROM/JOIN.
 */
public enum OwnedTable {
    BOOKS("books", "b",
            List.of("id", "userId", "name", "description", "currency", "isArchived", "createdAt", "updatedAt"),
            Set.of("name", "description", "currency", "isArchived")),
    CATEGORIES("categories", "c",
            List.of("id", "bookId", "name", "description", "icon", "color", "isDisabled", "isDefault", "createdAt", "updatedAt"),
            Set.of("name", "description", "icon", "color", "isDisabled")),
    EXPENSES("expenses", "e",
            List.of("id", "categoryId", "amount", "date", "description", "paymentMethod", "isDisabled", "createdAt", "updatedAt"),
            Set.of("amount", "date", "description", "paymentMethod", "isDisabled"));

    /** Không câu UPDATE nào được gán các cột này. */
    public static final Set<String> SENSITIVE_COLUMNS = Set.of("id", "userId", "bookId", "categoryId", "createdAt");

    public static final String OWNER_COLUMN = "userId";

    private final String tableName;
    private final String alias;
    private final List<String> columns;
    private final Set<String> updatableColumns;

    OwnedTable(String tableName, String alias, List<String> columns, Set<String> updatableColumns) {
        this.tableName = tableName;
        this.alias = alias;
        this.columns = columns;
        this.updatableColumns = updatableColumns;
    }

    public String tableName() {
        return tableName;
    }

    public String alias() {
        return alias;
    }

    public List<String> columns() {
        return columns;
    }

    public Set<String> updatableColumns() {
        return updatableColumns;
    }

    /** Trả về tên cột chuẩn (camelCase) nếu bảng có cột này, không phân biệt hoa thường. */
    public Optional<String> canonicalColumn(String raw) {
        if (raw == null) return Optional.empty();
        for (String c : columns) {
            if (c.equalsIgnoreCase(raw)) return Optional.of(c);
        }
        return Optional.empty();
    }

    /** Độ sâu trong chuỗi sở hữu: expenses sâu nhất, books nông nhất. */
    public int depth() {
        return switch (this) {
            case BOOKS -> 0;
            case CATEGORIES -> 1;
            case EXPENSES -> 2;
        };
    }

    public static Optional<OwnedTable> fromName(String raw) {
        if (raw == null) return Optional.empty();
        String n = raw.trim().toLowerCase(Locale.ROOT);
        for (OwnedTable t : values()) {
            if (t.tableName.equals(n)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
