package com.example.expensechat.service.sql.dto;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** INSERT một dòng vào một bảng sở hữu. Cột và giá trị song song theo vị trí. */
public record InsertStatement(OwnedTable table, List<String> columns, List<SqlValue> values)
        implements ClassifiedStatement {

    public InsertStatement {
        if (columns.size() != values.size()) {
            throw new IllegalArgumentException("columns/values size mismatch");
        }
        columns = List.copyOf(columns);
        values = List.copyOf(values);
    }

    @Override
    public StatementKind kind() {
        return StatementKind.INSERT;
    }

    public boolean has(String column) {
        return indexOf(column) >= 0;
    }

    public Optional<SqlValue> valueOf(String column) {
        int i = indexOf(column);
        return i < 0 ? Optional.empty() : Optional.of(values.get(i));
    }

    /** Thay giá trị của cột (hoặc thêm cột vào cuối nếu chưa có). */
    public InsertStatement with(String column, SqlValue value) {
        List<String> cols = new ArrayList<>(columns);
        List<SqlValue> vals = new ArrayList<>(values);
        int i = indexOf(column);
        if (i < 0) {
            cols.add(column);
            vals.add(value);
        } else {
            vals.set(i, value);
        }
        return new InsertStatement(table, cols, vals);
    }

    public InsertStatement withDefault(String column, SqlValue value) {
        return has(column) ? this : with(column, value);
    }

    private int indexOf(String column) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).equalsIgnoreCase(column)) return i;
        }
        return -1;
    }
}
