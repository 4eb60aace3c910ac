package com.example.expensechat.service.sql.rewrite;

import com.example.expensechat.service.sql.dto.ClassifiedStatement;
import com.example.expensechat.service.sql.dto.InsertStatement;
import com.example.expensechat.service.sql.dto.Join;
import com.example.expensechat.service.sql.dto.Predicate;
import com.example.expensechat.service.sql.dto.RenderedStatement;
import com.example.expensechat.service.sql.dto.SelectItem;
import com.example.expensechat.service.sql.dto.SelectStatement;
import com.example.expensechat.service.sql.dto.SqlValue;
import com.example.expensechat.service.sql.dto.StatementKind;
import com.example.expensechat.service.sql.dto.UpdateStatement;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/** IR → text SQL (MySQL). Chỉ được gọi ở ranh giới thực thi. */
@Component
public class SqlRenderer {

    public RenderedStatement render(ClassifiedStatement statement) {
        if (statement instanceof InsertStatement insert) {
            return new RenderedStatement(StatementKind.INSERT, insert.table(), insert(insert));
        }
        if (statement instanceof UpdateStatement update) {
            return new RenderedStatement(StatementKind.UPDATE, update.table(), update(update));
        }
        if (statement instanceof SelectStatement select) {
            return new RenderedStatement(StatementKind.SELECT, select.baseTable(), select(select));
        }
        throw new IllegalArgumentException("Statement cannot be rendered: " + statement.kind());
    }

    private static String insert(InsertStatement s) {
        return "INSERT INTO " + s.table().tableName()
                + " (" + String.join(", ", s.columns()) + ")"
                + " VALUES (" + s.values().stream().map(SqlValue::sql).collect(Collectors.joining(", ")) + ")";
    }

    private static String update(UpdateStatement s) {
        StringBuilder sb = new StringBuilder("UPDATE ").append(s.table().tableName()).append(" SET ");
        sb.append(s.assignments().stream()
                .map(a -> a.column() + " = " + a.value().sql())
                .collect(Collectors.joining(", ")));
        where(sb, s.filters());
        orderBy(sb, s.orderBy());
        if (s.limit() != null) sb.append(" LIMIT ").append(s.limit());
        return sb.toString();
    }

    private static String select(SelectStatement s) {
        StringBuilder sb = new StringBuilder("SELECT ");
        if (s.distinct()) sb.append("DISTINCT ");
        sb.append(s.projection().stream().map(SelectItem::render).collect(Collectors.joining(", ")));
        sb.append(" FROM ").append(s.baseTable().tableName()).append(' ').append(s.baseTable().alias());
        for (Join j : s.joins()) sb.append(' ').append(j.render());
        where(sb, s.filters());
        if (!s.groupBy().isEmpty()) sb.append(" GROUP BY ").append(String.join(", ", s.groupBy()));
        if (s.having() != null) sb.append(" HAVING ").append(s.having());
        orderBy(sb, s.orderBy());
        if (s.limit() != null) sb.append(" LIMIT ").append(s.limit());
        if (s.offset() != null) sb.append(" OFFSET ").append(s.offset());
        return sb.toString();
    }

    private static void where(StringBuilder sb, List<Predicate> filters) {
        if (filters.isEmpty()) return;
        sb.append(" WHERE ").append(filters.stream().map(Predicate::render).collect(Collectors.joining(" AND ")));
    }

    private static void orderBy(StringBuilder sb, List<String> items) {
        if (!items.isEmpty()) sb.append(" ORDER BY ").append(String.join(", ", items));
    }
}
