package com.example.expensechat.service.sql.dto;

import java.util.List;

/**
 * Một vế AND trong mệnh đề WHERE.
 *
 * @param sql              text đã chuẩn hoá alias
 * @param columns          các cột được tham chiếu
 * @param compound         true nếu vế chứa OR/XOR ở mức ngoài cùng (phải bọc ngoặc khi ghép)
 * @param ownerScope       true nếu vế do gateway thêm để ràng buộc người dùng
 * @param equalityColumn   cột ở vế trái nếu vế có dạng {@code col = 'literal'}
 * @param equalityLiteral  literal tương ứng
 */
public record Predicate(String sql,
                        List<ColumnRef> columns,
                        boolean compound,
                        boolean ownerScope,
                        ColumnRef equalityColumn,
                        String equalityLiteral) {

    public Predicate {
        columns = List.copyOf(columns);
    }

    public static Predicate owner(String sql, ColumnRef ownerColumn) {
        return new Predicate(sql, List.of(ownerColumn), false, true, null, null);
    }

    public boolean references(String column) {
        return columns.stream().anyMatch(c -> c.is(column));
    }

    public boolean isEquality() {
        return equalityColumn != null && equalityLiteral != null;
    }

    public String render() {
        return compound ? "(" + sql + ")" : sql;
    }
}
